package com.jsdesugar.ast;

public record ClassExpression(
    Span span,
    Identifier id,  // Can be null
    Expression superClass,  // Can be null
    ClassBody body
) implements Expression {
    public ClassExpression(Identifier id, Expression superClass, ClassBody body) {
        this(Span.NONE, id, superClass, body);
    }

    @Override
    public String type() {
        return "ClassExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitClassExpression(this);
    }
}
