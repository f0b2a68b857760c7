package com.jsdesugar.ast;

public record ReturnStatement(
    Span span,
    Expression argument  // Can be null
) implements Statement {
    public ReturnStatement(Expression argument) {
        this(Span.NONE, argument);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }
}
