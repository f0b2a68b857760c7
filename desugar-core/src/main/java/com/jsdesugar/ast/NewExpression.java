package com.jsdesugar.ast;

import java.util.List;

public record NewExpression(
    Span span,
    Expression callee,
    List<Expression> arguments
) implements Expression {
    public NewExpression(Expression callee, List<Expression> arguments) {
        this(Span.NONE, callee, arguments);
    }

    @Override
    public String type() {
        return "NewExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNewExpression(this);
    }
}
