package com.jsdesugar.ast;

import java.util.List;

public record ObjectExpression(
    Span span,
    List<Node> properties  // Property or SpreadElement
) implements Expression {
    public ObjectExpression(List<Node> properties) {
        this(Span.NONE, properties);
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitObjectExpression(this);
    }
}
