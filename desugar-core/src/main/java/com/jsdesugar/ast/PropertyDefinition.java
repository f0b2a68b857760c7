package com.jsdesugar.ast;

public record PropertyDefinition(
    Span span,
    Expression key,
    Expression value,  // Can be null
    boolean computed,
    boolean isStatic
) implements Node {
    public PropertyDefinition(Expression key, Expression value, boolean computed, boolean isStatic) {
        this(Span.NONE, key, value, computed, isStatic);
    }

    @Override
    public String type() {
        return "PropertyDefinition";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPropertyDefinition(this);
    }
}
