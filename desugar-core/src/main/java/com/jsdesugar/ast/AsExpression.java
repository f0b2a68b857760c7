package com.jsdesugar.ast;

public record AsExpression(
    Span span,
    Expression expression,
    String typeAnnotation  // Target type as written, e.g. "Foo"
) implements Expression {
    public AsExpression(Expression expression, String typeAnnotation) {
        this(Span.NONE, expression, typeAnnotation);
    }

    @Override
    public String type() {
        return "TSAsExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAsExpression(this);
    }
}
