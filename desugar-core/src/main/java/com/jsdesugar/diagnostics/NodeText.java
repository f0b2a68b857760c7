package com.jsdesugar.diagnostics;

import com.jsdesugar.ast.*;

import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Renders a node as compact single-line JavaScript/TypeScript for use in messages.
 * Parentheses are added where operator precedence requires them; formatting and
 * comments of the original source are not reproduced.
 */
public final class NodeText implements NodeVisitor<String> {

    // Precedence levels, higher binds tighter
    private static final int SEQUENCE = 1;
    private static final int ASSIGNMENT = 2;
    private static final int CONDITIONAL = 3;
    private static final int NULLISH = 4;
    private static final int OR = 5;
    private static final int AND = 6;
    private static final int BIT_OR = 7;
    private static final int BIT_XOR = 8;
    private static final int BIT_AND = 9;
    private static final int EQUALITY = 10;
    private static final int RELATIONAL = 11;
    private static final int SHIFT = 12;
    private static final int ADDITIVE = 13;
    private static final int MULTIPLICATIVE = 14;
    private static final int EXPONENT = 15;
    private static final int PREFIX = 16;
    private static final int POSTFIX = 17;
    private static final int CALL = 19;
    private static final int PRIMARY = 20;

    private static final Set<String> WORD_OPERATORS = Set.of("typeof", "void", "delete", "instanceof", "in");

    private static final NodeText INSTANCE = new NodeText();

    private NodeText() {
    }

    public static String of(Node node) {
        return node == null ? "" : node.accept(INSTANCE);
    }

    private static int precedence(Node node) {
        if (node instanceof SequenceExpression) {
            return SEQUENCE;
        }
        if (node instanceof AssignmentExpression || node instanceof ArrowFunctionExpression || node instanceof SpreadElement) {
            return ASSIGNMENT;
        }
        if (node instanceof ConditionalExpression) {
            return CONDITIONAL;
        }
        if (node instanceof LogicalExpression logical) {
            return binaryPrecedence(logical.operator());
        }
        if (node instanceof BinaryExpression binary) {
            return binaryPrecedence(binary.operator());
        }
        if (node instanceof AsExpression) {
            return RELATIONAL;
        }
        if (node instanceof UnaryExpression) {
            return PREFIX;
        }
        if (node instanceof UpdateExpression update) {
            return update.prefix() ? PREFIX : POSTFIX;
        }
        if (node instanceof CallExpression || node instanceof MemberExpression
            || node instanceof NewExpression || node instanceof ChainExpression) {
            return CALL;
        }
        return PRIMARY;
    }

    private static int binaryPrecedence(String operator) {
        switch (operator) {
            case "??":
                return NULLISH;
            case "||":
                return OR;
            case "&&":
                return AND;
            case "|":
                return BIT_OR;
            case "^":
                return BIT_XOR;
            case "&":
                return BIT_AND;
            case "==":
            case "!=":
            case "===":
            case "!==":
                return EQUALITY;
            case "<":
            case ">":
            case "<=":
            case ">=":
            case "instanceof":
            case "in":
                return RELATIONAL;
            case "<<":
            case ">>":
            case ">>>":
                return SHIFT;
            case "+":
            case "-":
                return ADDITIVE;
            case "*":
            case "/":
            case "%":
                return MULTIPLICATIVE;
            case "**":
                return EXPONENT;
            default:
                return PRIMARY;
        }
    }

    private String operand(Node node, int minimum) {
        String text = of(node);
        return precedence(node) < minimum ? "(" + text + ")" : text;
    }

    private String join(List<? extends Node> nodes, int minimum) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Node node : nodes) {
            joiner.add(node == null ? "" : operand(node, minimum));
        }
        return joiner.toString();
    }

    private String binary(String operator, Expression left, Expression right) {
        int level = binaryPrecedence(operator);
        // ** is right-associative, everything else left-associative
        boolean rightAssociative = "**".equals(operator);
        return operand(left, rightAssociative ? level + 1 : level)
            + " " + operator + " "
            + operand(right, rightAssociative ? level : level + 1);
    }

    private String params(List<Pattern> params) {
        return "(" + join(params, ASSIGNMENT) + ")";
    }

    private String functionText(String prefix, Identifier id, FunctionExpression function) {
        return prefix + (id != null ? id.name() : "") + params(function.params()) + " " + of(function.body());
    }

    private String key(Expression key, boolean computed) {
        return computed ? "[" + operand(key, ASSIGNMENT) + "]" : of(key);
    }

    private String classText(Identifier id, Expression superClass, ClassBody body) {
        StringBuilder text = new StringBuilder("class");
        if (id != null) {
            text.append(' ').append(id.name());
        }
        if (superClass != null) {
            text.append(" extends ").append(operand(superClass, CALL));
        }
        return text.append(' ').append(of(body)).toString();
    }

    private String declarationText(VariableDeclaration node) {
        return node.kind() + " " + join(node.declarations(), SEQUENCE);
    }

    // Program and statements

    @Override
    public String visitProgram(Program node) {
        StringJoiner joiner = new StringJoiner("\n");
        node.body().forEach(statement -> joiner.add(of(statement)));
        return joiner.toString();
    }

    @Override
    public String visitExpressionStatement(ExpressionStatement node) {
        return of(node.expression()) + ";";
    }

    @Override
    public String visitBlockStatement(BlockStatement node) {
        if (node.body().isEmpty()) {
            return "{}";
        }
        StringJoiner joiner = new StringJoiner(" ", "{ ", " }");
        node.body().forEach(statement -> joiner.add(of(statement)));
        return joiner.toString();
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node) {
        return declarationText(node) + ";";
    }

    @Override
    public String visitVariableDeclarator(VariableDeclarator node) {
        return node.init() == null ? of(node.id()) : of(node.id()) + " = " + operand(node.init(), ASSIGNMENT);
    }

    @Override
    public String visitReturnStatement(ReturnStatement node) {
        return node.argument() == null ? "return;" : "return " + of(node.argument()) + ";";
    }

    @Override
    public String visitIfStatement(IfStatement node) {
        String text = "if (" + of(node.test()) + ") " + of(node.consequent());
        return node.alternate() == null ? text : text + " else " + of(node.alternate());
    }

    @Override
    public String visitForStatement(ForStatement node) {
        String init = node.init() instanceof VariableDeclaration declaration ? declarationText(declaration) : of(node.init());
        return "for (" + init + "; " + of(node.test()) + "; " + of(node.update()) + ") " + of(node.body());
    }

    @Override
    public String visitForOfStatement(ForOfStatement node) {
        String left = node.left() instanceof VariableDeclaration declaration ? declarationText(declaration) : of(node.left());
        return "for " + (node.await() ? "await " : "") + "(" + left + " of " + operand(node.right(), ASSIGNMENT) + ") "
            + of(node.body());
    }

    @Override
    public String visitWhileStatement(WhileStatement node) {
        return "while (" + of(node.test()) + ") " + of(node.body());
    }

    @Override
    public String visitThrowStatement(ThrowStatement node) {
        return "throw " + of(node.argument()) + ";";
    }

    @Override
    public String visitFunctionDeclaration(FunctionDeclaration node) {
        String prefix = (node.async() ? "async " : "") + "function" + (node.generator() ? "* " : " ");
        return prefix + (node.id() != null ? node.id().name() : "") + params(node.params()) + " " + of(node.body());
    }

    @Override
    public String visitClassDeclaration(ClassDeclaration node) {
        return classText(node.id(), node.superClass(), node.body());
    }

    @Override
    public String visitEmptyStatement(EmptyStatement node) {
        return ";";
    }

    // Expressions

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitLiteral(Literal node) {
        if (node.raw() != null) {
            return node.raw();
        }
        Object value = node.value();
        if (value == null) {
            return "null";
        }
        if (value instanceof String string) {
            return "\"" + string.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        if (value instanceof Double number && number == Math.floor(number) && !number.isInfinite()) {
            return Long.toString(number.longValue());
        }
        return value.toString();
    }

    @Override
    public String visitThisExpression(ThisExpression node) {
        return "this";
    }

    @Override
    public String visitSuper(Super node) {
        return "super";
    }

    @Override
    public String visitMemberExpression(MemberExpression node) {
        String object = operand(node.object(), CALL);
        if (node.computed()) {
            return object + (node.optional() ? "?.[" : "[") + of(node.property()) + "]";
        }
        return object + (node.optional() ? "?." : ".") + of(node.property());
    }

    @Override
    public String visitCallExpression(CallExpression node) {
        return operand(node.callee(), CALL) + (node.optional() ? "?.(" : "(") + join(node.arguments(), ASSIGNMENT) + ")";
    }

    @Override
    public String visitNewExpression(NewExpression node) {
        String callee = node.callee() instanceof CallExpression ? "(" + of(node.callee()) + ")" : operand(node.callee(), CALL);
        return "new " + callee + "(" + join(node.arguments(), ASSIGNMENT) + ")";
    }

    @Override
    public String visitAssignmentExpression(AssignmentExpression node) {
        return of(node.left()) + " " + node.operator() + " " + operand(node.right(), ASSIGNMENT);
    }

    @Override
    public String visitUpdateExpression(UpdateExpression node) {
        return node.prefix()
            ? node.operator() + operand(node.argument(), PREFIX)
            : operand(node.argument(), POSTFIX) + node.operator();
    }

    @Override
    public String visitBinaryExpression(BinaryExpression node) {
        return binary(node.operator(), node.left(), node.right());
    }

    @Override
    public String visitLogicalExpression(LogicalExpression node) {
        return binary(node.operator(), node.left(), node.right());
    }

    @Override
    public String visitUnaryExpression(UnaryExpression node) {
        String separator = WORD_OPERATORS.contains(node.operator()) ? " " : "";
        return node.operator() + separator + operand(node.argument(), PREFIX);
    }

    @Override
    public String visitConditionalExpression(ConditionalExpression node) {
        return operand(node.test(), NULLISH) + " ? " + operand(node.consequent(), ASSIGNMENT)
            + " : " + operand(node.alternate(), ASSIGNMENT);
    }

    @Override
    public String visitArrowFunctionExpression(ArrowFunctionExpression node) {
        String body;
        if (node.body() instanceof ObjectExpression) {
            body = "(" + of(node.body()) + ")";
        } else if (node.body() instanceof BlockStatement) {
            body = of(node.body());
        } else {
            body = operand(node.body(), ASSIGNMENT);
        }
        return (node.async() ? "async " : "") + params(node.params()) + " => " + body;
    }

    @Override
    public String visitFunctionExpression(FunctionExpression node) {
        String prefix = (node.async() ? "async " : "") + "function" + (node.generator() ? "* " : " ");
        return functionText(prefix, node.id(), node);
    }

    @Override
    public String visitObjectExpression(ObjectExpression node) {
        if (node.properties().isEmpty()) {
            return "{}";
        }
        return "{ " + join(node.properties(), ASSIGNMENT) + " }";
    }

    @Override
    public String visitProperty(Property node) {
        if (node.shorthand()) {
            return of(node.value());
        }
        String key = key(node.key(), node.computed());
        if (!"init".equals(node.kind()) || node.method()) {
            FunctionExpression function = (FunctionExpression) node.value();
            String prefix = "init".equals(node.kind()) ? "" : node.kind() + " ";
            return prefix + key + params(function.params()) + " " + of(function.body());
        }
        return key + ": " + operand(node.value(), ASSIGNMENT);
    }

    @Override
    public String visitArrayExpression(ArrayExpression node) {
        return "[" + join(node.elements(), ASSIGNMENT) + "]";
    }

    @Override
    public String visitChainExpression(ChainExpression node) {
        return of(node.expression());
    }

    @Override
    public String visitParenthesizedExpression(ParenthesizedExpression node) {
        return "(" + of(node.expression()) + ")";
    }

    @Override
    public String visitAsExpression(AsExpression node) {
        return operand(node.expression(), RELATIONAL) + " as " + node.typeAnnotation();
    }

    @Override
    public String visitSequenceExpression(SequenceExpression node) {
        return join(node.expressions(), ASSIGNMENT);
    }

    @Override
    public String visitTemplateLiteral(TemplateLiteral node) {
        StringBuilder text = new StringBuilder("`");
        for (int i = 0; i < node.quasis().size(); i++) {
            text.append(of(node.quasis().get(i)));
            if (i < node.expressions().size()) {
                text.append("${").append(of(node.expressions().get(i))).append('}');
            }
        }
        return text.append('`').toString();
    }

    @Override
    public String visitTemplateElement(TemplateElement node) {
        return node.value().raw();
    }

    @Override
    public String visitClassExpression(ClassExpression node) {
        return classText(node.id(), node.superClass(), node.body());
    }

    @Override
    public String visitSpreadElement(SpreadElement node) {
        return "..." + operand(node.argument(), ASSIGNMENT);
    }

    // Patterns

    @Override
    public String visitObjectPattern(ObjectPattern node) {
        if (node.properties().isEmpty()) {
            return "{}";
        }
        return "{ " + join(node.properties(), ASSIGNMENT) + " }";
    }

    @Override
    public String visitArrayPattern(ArrayPattern node) {
        return "[" + join(node.elements(), ASSIGNMENT) + "]";
    }

    @Override
    public String visitAssignmentPattern(AssignmentPattern node) {
        return of(node.left()) + " = " + operand(node.right(), ASSIGNMENT);
    }

    @Override
    public String visitRestElement(RestElement node) {
        return "..." + of(node.argument());
    }

    // Classes

    @Override
    public String visitClassBody(ClassBody node) {
        if (node.body().isEmpty()) {
            return "{}";
        }
        StringJoiner joiner = new StringJoiner(" ", "{ ", " }");
        node.body().forEach(member -> joiner.add(of(member)));
        return joiner.toString();
    }

    @Override
    public String visitMethodDefinition(MethodDefinition node) {
        StringBuilder text = new StringBuilder();
        if (node.isStatic()) {
            text.append("static ");
        }
        if (node.accessor()) {
            text.append(node.kind()).append(' ');
        }
        if (node.value().async()) {
            text.append("async ");
        }
        if (node.value().generator()) {
            text.append('*');
        }
        text.append(key(node.key(), node.computed()));
        return text.append(params(node.value().params())).append(' ').append(of(node.value().body())).toString();
    }

    @Override
    public String visitPropertyDefinition(PropertyDefinition node) {
        String text = (node.isStatic() ? "static " : "") + key(node.key(), node.computed());
        return node.value() == null ? text + ";" : text + " = " + operand(node.value(), ASSIGNMENT) + ";";
    }
}
