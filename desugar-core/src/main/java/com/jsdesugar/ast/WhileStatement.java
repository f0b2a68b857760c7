package com.jsdesugar.ast;

public record WhileStatement(
    Span span,
    Expression test,
    Statement body
) implements Statement {
    public WhileStatement(Expression test, Statement body) {
        this(Span.NONE, test, body);
    }

    @Override
    public String type() {
        return "WhileStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWhileStatement(this);
    }
}
