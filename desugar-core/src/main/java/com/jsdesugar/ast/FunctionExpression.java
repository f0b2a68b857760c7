package com.jsdesugar.ast;

import java.util.List;

public record FunctionExpression(
    Span span,
    Identifier id,  // Can be null
    List<Pattern> params,
    BlockStatement body,
    boolean generator,
    boolean async
) implements Expression {
    public FunctionExpression(Identifier id, List<Pattern> params, BlockStatement body, boolean generator, boolean async) {
        this(Span.NONE, id, params, body, generator, async);
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionExpression(this);
    }
}
