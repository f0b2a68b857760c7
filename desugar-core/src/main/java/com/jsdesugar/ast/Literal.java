package com.jsdesugar.ast;

public record Literal(
    Span span,
    Object value,  // String, Double, Boolean or null
    String raw
) implements Expression {
    public Literal(Object value, String raw) {
        this(Span.NONE, value, raw);
    }

    @Override
    public String type() {
        return "Literal";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
