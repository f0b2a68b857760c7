package com.jsdesugar.ast;

import java.util.List;

public record BlockStatement(
    Span span,
    List<Statement> body
) implements Statement {
    public BlockStatement(List<Statement> body) {
        this(Span.NONE, body);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlockStatement(this);
    }
}
