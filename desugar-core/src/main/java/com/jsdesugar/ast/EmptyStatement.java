package com.jsdesugar.ast;

public record EmptyStatement(
    Span span
) implements Statement {
    public EmptyStatement() {
        this(Span.NONE);
    }

    @Override
    public String type() {
        return "EmptyStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitEmptyStatement(this);
    }
}
