package com.jsdesugar.ast;

public record TemplateElement(
    Span span,
    TemplateElementValue value,
    boolean tail
) implements Node {
    public TemplateElement(TemplateElementValue value, boolean tail) {
        this(Span.NONE, value, tail);
    }

    @Override
    public String type() {
        return "TemplateElement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTemplateElement(this);
    }

    public record TemplateElementValue(String raw, String cooked) {}
}
