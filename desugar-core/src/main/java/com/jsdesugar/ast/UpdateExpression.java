package com.jsdesugar.ast;

public record UpdateExpression(
    Span span,
    String operator,  // "++" | "--"
    boolean prefix,  // true for ++x, false for x++
    Expression argument
) implements Expression {
    public UpdateExpression(String operator, boolean prefix, Expression argument) {
        this(Span.NONE, operator, prefix, argument);
    }

    @Override
    public String type() {
        return "UpdateExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUpdateExpression(this);
    }
}
