package com.jsdesugar.ast;

import java.util.List;

public record ArrayPattern(
    Span span,
    List<Pattern> elements  // null entries are holes
) implements Pattern {
    public ArrayPattern(List<Pattern> elements) {
        this(Span.NONE, elements);
    }

    @Override
    public String type() {
        return "ArrayPattern";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitArrayPattern(this);
    }
}
