package com.jsdesugar.ast;

public record ExpressionStatement(
    Span span,
    Expression expression
) implements Statement {
    public ExpressionStatement(Expression expression) {
        this(Span.NONE, expression);
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }
}
