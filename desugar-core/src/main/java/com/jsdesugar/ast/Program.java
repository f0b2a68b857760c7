package com.jsdesugar.ast;

import java.util.List;

public record Program(
    Span span,
    List<Statement> body,
    String sourceType  // "script" | "module"
) implements Node {
    public Program(List<Statement> body, String sourceType) {
        this(Span.NONE, body, sourceType);
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
