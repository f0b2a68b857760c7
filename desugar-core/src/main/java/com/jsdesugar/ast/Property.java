package com.jsdesugar.ast;

public record Property(
    Span span,
    Expression key,
    Node value,  // Expression, or Pattern inside an ObjectPattern
    String kind,  // "init" | "get" | "set"
    boolean method,
    boolean shorthand,
    boolean computed
) implements Node {
    public Property(Expression key, Node value, String kind, boolean method, boolean shorthand, boolean computed) {
        this(Span.NONE, key, value, kind, method, shorthand, computed);
    }

    @Override
    public String type() {
        return "Property";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitProperty(this);
    }
}
