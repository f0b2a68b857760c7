package com.jsdesugar.ast;

import java.util.List;

public record ArrowFunctionExpression(
    Span span,
    List<Pattern> params,
    Node body,  // BlockStatement or Expression
    boolean expression,  // true when body is an Expression
    boolean async
) implements Expression {
    public ArrowFunctionExpression(List<Pattern> params, Node body, boolean expression, boolean async) {
        this(Span.NONE, params, body, expression, async);
    }

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArrowFunctionExpression(this);
    }
}
