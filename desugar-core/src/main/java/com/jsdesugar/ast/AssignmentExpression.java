package com.jsdesugar.ast;

public record AssignmentExpression(
    Span span,
    String operator,  // "=" | "+=" | "??=" | ...
    Node left,  // Pattern, or an expression wrapping one (parentheses, as-casts)
    Expression right
) implements Expression {
    public AssignmentExpression(String operator, Node left, Expression right) {
        this(Span.NONE, operator, left, right);
    }

    @Override
    public String type() {
        return "AssignmentExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssignmentExpression(this);
    }
}
