package com.jsdesugar.ast;

public record ConditionalExpression(
    Span span,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {
    public ConditionalExpression(Expression test, Expression consequent, Expression alternate) {
        this(Span.NONE, test, consequent, alternate);
    }

    @Override
    public String type() {
        return "ConditionalExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditionalExpression(this);
    }
}
