package com.jsdesugar.ast;

public record Super(
    Span span
) implements Expression {
    public Super() {
        this(Span.NONE);
    }

    @Override
    public String type() {
        return "Super";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSuper(this);
    }
}
