package com.jsdesugar.ast;

public record AssignmentPattern(
    Span span,
    Pattern left,
    Expression right
) implements Pattern {
    public AssignmentPattern(Pattern left, Expression right) {
        this(Span.NONE, left, right);
    }

    @Override
    public String type() {
        return "AssignmentPattern";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssignmentPattern(this);
    }
}
