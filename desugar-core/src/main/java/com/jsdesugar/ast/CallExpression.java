package com.jsdesugar.ast;

import java.util.List;

public record CallExpression(
    Span span,
    Expression callee,
    List<Expression> arguments,
    boolean optional  // true for callee?.()
) implements Expression {
    public CallExpression(Expression callee, List<Expression> arguments, boolean optional) {
        this(Span.NONE, callee, arguments, optional);
    }

    @Override
    public String type() {
        return "CallExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCallExpression(this);
    }
}
