package com.jsdesugar.ast;

public record ThrowStatement(
    Span span,
    Expression argument
) implements Statement {
    public ThrowStatement(Expression argument) {
        this(Span.NONE, argument);
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThrowStatement(this);
    }
}
