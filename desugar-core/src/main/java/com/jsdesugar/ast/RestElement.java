package com.jsdesugar.ast;

public record RestElement(
    Span span,
    Pattern argument
) implements Pattern {
    public RestElement(Pattern argument) {
        this(Span.NONE, argument);
    }

    @Override
    public String type() {
        return "RestElement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRestElement(this);
    }
}
