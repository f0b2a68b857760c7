package com.jsdesugar.testing;

import com.jsdesugar.ast.*;

import java.util.Arrays;
import java.util.List;

/**
 * Short-hand constructors for building trees in tests, standing in for a parser.
 */
public final class Ast {

    private Ast() {
    }

    public static Program program(Statement... body) {
        return new Program(List.of(body), "module");
    }

    public static ExpressionStatement stmt(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static BlockStatement block(Statement... body) {
        return new BlockStatement(List.of(body));
    }

    public static ReturnStatement ret(Expression argument) {
        return new ReturnStatement(argument);
    }

    public static VariableDeclaration let(String name, Expression init) {
        return new VariableDeclaration(List.of(new VariableDeclarator(id(name), init)), "let");
    }

    public static Identifier id(String name) {
        return new Identifier(name);
    }

    public static Literal num(int value) {
        return new Literal((double) value, Integer.toString(value));
    }

    public static Literal str(String value) {
        return new Literal(value, "\"" + value + "\"");
    }

    public static ThisExpression self() {
        return new ThisExpression();
    }

    public static MemberExpression member(Expression object, String name) {
        return new MemberExpression(object, id(name), false);
    }

    public static MemberExpression member(String object, String name) {
        return member(id(object), name);
    }

    public static MemberExpression optionalMember(Expression object, String name) {
        return new MemberExpression(object, id(name), false, true);
    }

    public static MemberExpression computed(Expression object, Expression property) {
        return new MemberExpression(object, property, true);
    }

    public static AssignmentExpression assign(Node left, Expression right) {
        return assign("=", left, right);
    }

    public static AssignmentExpression assign(String operator, Node left, Expression right) {
        return new AssignmentExpression(operator, left, right);
    }

    public static UpdateExpression postfix(String operator, Expression argument) {
        return new UpdateExpression(operator, false, argument);
    }

    public static UpdateExpression prefix(String operator, Expression argument) {
        return new UpdateExpression(operator, true, argument);
    }

    public static BinaryExpression binary(String operator, Expression left, Expression right) {
        return new BinaryExpression(operator, left, right);
    }

    public static CallExpression call(Expression callee, Expression... arguments) {
        return new CallExpression(callee, List.of(arguments), false);
    }

    public static NewExpression newExpr(String className, Expression... arguments) {
        return new NewExpression(id(className), List.of(arguments));
    }

    public static ParenthesizedExpression paren(Expression expression) {
        return new ParenthesizedExpression(expression);
    }

    public static AsExpression as(Expression expression, String type) {
        return new AsExpression(expression, type);
    }

    public static ChainExpression chain(Expression expression) {
        return new ChainExpression(expression);
    }

    public static ObjectPattern objectPattern(Property... properties) {
        return new ObjectPattern(Arrays.<Node>asList(properties));
    }

    public static Property patternProperty(String key, Node value) {
        return new Property(id(key), value, "init", false, false, false);
    }

    // {name = fallback}
    public static Property shorthandProperty(String name, Expression fallback) {
        return new Property(id(name), new AssignmentPattern(id(name), fallback), "init", false, true, false);
    }

    public static ArrayPattern arrayPattern(Pattern... elements) {
        return new ArrayPattern(List.of(elements));
    }

    public static ClassDeclaration classDecl(String name, Node... members) {
        return new ClassDeclaration(id(name), null, new ClassBody(List.of(members)));
    }

    public static ClassDeclaration classDecl(String name, String superClass, Node... members) {
        return new ClassDeclaration(id(name), id(superClass), new ClassBody(List.of(members)));
    }

    public static MethodDefinition getter(String name, Statement... body) {
        return accessor(MethodDefinition.KIND_GET, name, List.of(), body);
    }

    public static MethodDefinition setter(String name, String param, Statement... body) {
        return accessor(MethodDefinition.KIND_SET, name, List.of(id(param)), body);
    }

    public static MethodDefinition method(String name, Statement... body) {
        return accessor(MethodDefinition.KIND_METHOD, name, List.of(), body);
    }

    private static MethodDefinition accessor(String kind, String name, List<Pattern> params, Statement... body) {
        FunctionExpression function = new FunctionExpression(null, params, block(body), false, false);
        return new MethodDefinition(id(name), function, kind, false, false);
    }
}
