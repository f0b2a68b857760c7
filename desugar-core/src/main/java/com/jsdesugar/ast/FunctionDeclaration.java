package com.jsdesugar.ast;

import java.util.List;

public record FunctionDeclaration(
    Span span,
    Identifier id,
    List<Pattern> params,
    BlockStatement body,
    boolean generator,
    boolean async
) implements Statement {
    public FunctionDeclaration(Identifier id, List<Pattern> params, BlockStatement body, boolean generator, boolean async) {
        this(Span.NONE, id, params, body, generator, async);
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }
}
