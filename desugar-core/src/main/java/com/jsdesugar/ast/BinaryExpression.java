package com.jsdesugar.ast;

public record BinaryExpression(
    Span span,
    String operator,
    Expression left,
    Expression right
) implements Expression {
    public BinaryExpression(String operator, Expression left, Expression right) {
        this(Span.NONE, operator, left, right);
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }
}
