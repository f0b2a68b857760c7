package com.jsdesugar.ast;

public record MethodDefinition(
    Span span,
    Expression key,           // Property name (Identifier, or any expression when computed)
    FunctionExpression value,
    String kind,              // "constructor" | "method" | "get" | "set"
    boolean computed,
    boolean isStatic
) implements Node {
    public static final String KIND_GET = "get";
    public static final String KIND_SET = "set";
    public static final String KIND_METHOD = "method";

    public MethodDefinition(Expression key, FunctionExpression value, String kind, boolean computed, boolean isStatic) {
        this(Span.NONE, key, value, kind, computed, isStatic);
    }

    /**
     * True for {@code get} and {@code set} definitions.
     */
    public boolean accessor() {
        return KIND_GET.equals(kind) || KIND_SET.equals(kind);
    }

    /**
     * The declared name when the key is a plain identifier, otherwise null.
     */
    public String keyName() {
        if (!computed && key instanceof Identifier identifier) {
            return identifier.name();
        }
        return null;
    }

    @Override
    public String type() {
        return "MethodDefinition";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMethodDefinition(this);
    }
}
