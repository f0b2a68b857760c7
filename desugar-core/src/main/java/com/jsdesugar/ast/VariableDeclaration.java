package com.jsdesugar.ast;

import java.util.List;

public record VariableDeclaration(
    Span span,
    List<VariableDeclarator> declarations,
    String kind  // "var" | "let" | "const"
) implements Statement {
    public VariableDeclaration(List<VariableDeclarator> declarations, String kind) {
        this(Span.NONE, declarations, kind);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariableDeclaration(this);
    }
}
