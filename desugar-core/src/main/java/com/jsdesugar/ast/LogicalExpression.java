package com.jsdesugar.ast;

public record LogicalExpression(
    Span span,
    String operator,  // "&&" | "||" | "??"
    Expression left,
    Expression right
) implements Expression {
    public LogicalExpression(String operator, Expression left, Expression right) {
        this(Span.NONE, operator, left, right);
    }

    @Override
    public String type() {
        return "LogicalExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLogicalExpression(this);
    }
}
