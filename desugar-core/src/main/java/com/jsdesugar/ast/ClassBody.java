package com.jsdesugar.ast;

import java.util.List;

public record ClassBody(
    Span span,
    List<Node> body  // MethodDefinition or PropertyDefinition
) implements Node {
    public ClassBody(List<Node> body) {
        this(Span.NONE, body);
    }

    @Override
    public String type() {
        return "ClassBody";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitClassBody(this);
    }
}
