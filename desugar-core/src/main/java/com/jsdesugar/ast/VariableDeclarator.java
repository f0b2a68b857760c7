package com.jsdesugar.ast;

public record VariableDeclarator(
    Span span,
    Pattern id,
    Expression init  // null when there is no initializer
) implements Node {
    public VariableDeclarator(Pattern id, Expression init) {
        this(Span.NONE, id, init);
    }

    @Override
    public String type() {
        return "VariableDeclarator";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariableDeclarator(this);
    }
}
