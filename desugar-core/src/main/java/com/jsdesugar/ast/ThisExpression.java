package com.jsdesugar.ast;

public record ThisExpression(
    Span span
) implements Expression {
    public ThisExpression() {
        this(Span.NONE);
    }

    @Override
    public String type() {
        return "ThisExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThisExpression(this);
    }
}
