package com.jsdesugar.rewrite;

import com.jsdesugar.ast.*;

import java.util.List;
import java.util.Set;

/**
 * Builds the nodes that replace accessor syntax. Replacements take the span of
 * the construct they replace so that the emitter can still map them to source.
 */
public class NodeFactory {

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "??");

    /**
     * {@code object.methodName}, keeping the optional-chaining flag of the access it replaces.
     */
    public MemberExpression methodReference(MemberExpression original, Expression object, String methodName) {
        Identifier name = new Identifier(original.property().span(), methodName);
        return new MemberExpression(original.span(), object, name, false, original.optional());
    }

    public CallExpression call(Span span, Expression callee, List<Expression> arguments) {
        return new CallExpression(span, callee, List.copyOf(arguments), false);
    }

    /**
     * {@code object.getterName()} in place of a read of {@code original}.
     */
    public CallExpression getterCall(MemberExpression original, Expression object, String getterName) {
        return call(original.span(), methodReference(original, object, getterName), List.of());
    }

    /**
     * {@code left operator right}; the short-circuiting operators build a
     * {@link LogicalExpression}, all others a {@link BinaryExpression}.
     */
    public Expression combine(Span span, String operator, Expression left, Expression right) {
        if (LOGICAL_OPERATORS.contains(operator)) {
            return new LogicalExpression(span, operator, left, right);
        }
        return new BinaryExpression(span, operator, left, right);
    }

    public Literal number(int value) {
        return new Literal(Span.NONE, (double) value, Integer.toString(value));
    }

    /**
     * A plain method carrying the body of an accessor definition under a new name.
     */
    public MethodDefinition method(MethodDefinition accessor, String methodName, FunctionExpression value) {
        Identifier key = new Identifier(accessor.key().span(), methodName);
        return new MethodDefinition(accessor.span(), key, value, MethodDefinition.KIND_METHOD, false, accessor.isStatic());
    }
}
