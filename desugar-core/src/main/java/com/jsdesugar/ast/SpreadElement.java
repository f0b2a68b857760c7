package com.jsdesugar.ast;

public record SpreadElement(
    Span span,
    Expression argument
) implements Expression {
    public SpreadElement(Expression argument) {
        this(Span.NONE, argument);
    }

    @Override
    public String type() {
        return "SpreadElement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSpreadElement(this);
    }
}
