package com.jsdesugar.ast;

import java.util.List;

public record ObjectPattern(
    Span span,
    List<Node> properties  // Property or RestElement
) implements Pattern {
    public ObjectPattern(List<Node> properties) {
        this(Span.NONE, properties);
    }

    @Override
    public String type() {
        return "ObjectPattern";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitObjectPattern(this);
    }
}
