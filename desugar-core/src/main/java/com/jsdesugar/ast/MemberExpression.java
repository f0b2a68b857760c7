package com.jsdesugar.ast;

public record MemberExpression(
    Span span,
    Expression object,
    Expression property,
    boolean computed,
    boolean optional  // true for object?.property
) implements Expression, Pattern {
    public MemberExpression(Expression object, Expression property, boolean computed) {
        this(Span.NONE, object, property, computed, false);
    }

    public MemberExpression(Expression object, Expression property, boolean computed, boolean optional) {
        this(Span.NONE, object, property, computed, optional);
    }

    /**
     * The member name of a dotted access ({@code a.name}), or null for computed
     * ({@code a[k]}) and private ({@code a.#k}) access.
     */
    public String propertyName() {
        if (!computed && property instanceof Identifier identifier) {
            return identifier.name();
        }
        return null;
    }

    @Override
    public String type() {
        return "MemberExpression";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMemberExpression(this);
    }
}
