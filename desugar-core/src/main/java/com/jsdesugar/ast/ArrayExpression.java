package com.jsdesugar.ast;

import java.util.List;

public record ArrayExpression(
    Span span,
    List<Expression> elements  // null entries are holes
) implements Expression {
    public ArrayExpression(List<Expression> elements) {
        this(Span.NONE, elements);
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArrayExpression(this);
    }
}
