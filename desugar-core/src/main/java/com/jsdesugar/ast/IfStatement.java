package com.jsdesugar.ast;

public record IfStatement(
    Span span,
    Expression test,
    Statement consequent,
    Statement alternate  // Can be null
) implements Statement {
    public IfStatement(Expression test, Statement consequent, Statement alternate) {
        this(Span.NONE, test, consequent, alternate);
    }

    @Override
    public String type() {
        return "IfStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}
