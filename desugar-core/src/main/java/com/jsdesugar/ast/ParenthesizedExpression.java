package com.jsdesugar.ast;

public record ParenthesizedExpression(
    Span span,
    Expression expression
) implements Expression {
    public ParenthesizedExpression(Expression expression) {
        this(Span.NONE, expression);
    }

    @Override
    public String type() {
        return "ParenthesizedExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParenthesizedExpression(this);
    }
}
