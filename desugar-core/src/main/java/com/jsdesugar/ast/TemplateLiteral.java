package com.jsdesugar.ast;

import java.util.List;

public record TemplateLiteral(
    Span span,
    List<TemplateElement> quasis,
    List<Expression> expressions
) implements Expression {
    public TemplateLiteral(List<TemplateElement> quasis, List<Expression> expressions) {
        this(Span.NONE, quasis, expressions);
    }

    @Override
    public String type() {
        return "TemplateLiteral";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTemplateLiteral(this);
    }
}
