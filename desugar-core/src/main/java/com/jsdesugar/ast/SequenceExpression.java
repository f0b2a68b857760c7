package com.jsdesugar.ast;

import java.util.List;

public record SequenceExpression(
    Span span,
    List<Expression> expressions
) implements Expression {
    public SequenceExpression(List<Expression> expressions) {
        this(Span.NONE, expressions);
    }

    @Override
    public String type() {
        return "SequenceExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSequenceExpression(this);
    }
}
