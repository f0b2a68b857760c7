package com.jsdesugar.ast;

public record ForOfStatement(
    Span span,
    Node left,  // VariableDeclaration or Pattern
    Expression right,
    Statement body,
    boolean await
) implements Statement {
    public ForOfStatement(Node left, Expression right, Statement body, boolean await) {
        this(Span.NONE, left, right, body, await);
    }

    @Override
    public String type() {
        return "ForOfStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitForOfStatement(this);
    }
}
