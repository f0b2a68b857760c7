package com.jsdesugar.ast;

public record ClassDeclaration(
    Span span,
    Identifier id,  // Class name
    Expression superClass,  // Can be null if no extends
    ClassBody body
) implements Statement {
    public ClassDeclaration(Identifier id, Expression superClass, ClassBody body) {
        this(Span.NONE, id, superClass, body);
    }

    @Override
    public String type() {
        return "ClassDeclaration";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitClassDeclaration(this);
    }
}
