package com.jsdesugar.ast;

public record UnaryExpression(
    Span span,
    String operator,
    boolean prefix,
    Expression argument
) implements Expression {
    public UnaryExpression(String operator, boolean prefix, Expression argument) {
        this(Span.NONE, operator, prefix, argument);
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnaryExpression(this);
    }
}
