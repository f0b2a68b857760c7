package com.jsdesugar.ast;

public record ForStatement(
    Span span,
    Node init,  // VariableDeclaration, Expression or null
    Expression test,
    Expression update,
    Statement body
) implements Statement {
    public ForStatement(Node init, Expression test, Expression update, Statement body) {
        this(Span.NONE, init, test, update, body);
    }

    @Override
    public String type() {
        return "ForStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitForStatement(this);
    }
}
