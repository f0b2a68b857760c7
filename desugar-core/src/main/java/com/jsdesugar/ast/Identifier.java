package com.jsdesugar.ast;

public record Identifier(
    Span span,
    String name
) implements Expression, Pattern {
    public Identifier(String name) {
        this(Span.NONE, name);
    }

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
