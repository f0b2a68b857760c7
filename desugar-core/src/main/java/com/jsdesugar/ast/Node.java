package com.jsdesugar.ast;

/**
 * Base interface for all ESTree AST nodes.
 *
 * <p>Nodes are immutable. A rewrite never changes a node in place; it builds a
 * replacement and leaves the input tree untouched.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    Pattern,
    VariableDeclarator,
    Property,
    TemplateElement,
    ClassBody,
    MethodDefinition,
    PropertyDefinition {

    String type();

    Span span();

    <R> R accept(NodeVisitor<R> visitor);
}
