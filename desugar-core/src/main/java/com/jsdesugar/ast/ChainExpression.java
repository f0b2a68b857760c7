package com.jsdesugar.ast;

public record ChainExpression(
    Span span,
    Expression expression
) implements Expression {
    public ChainExpression(Expression expression) {
        this(Span.NONE, expression);
    }

    @Override
    public String type() {
        return "ChainExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitChainExpression(this);
    }
}
