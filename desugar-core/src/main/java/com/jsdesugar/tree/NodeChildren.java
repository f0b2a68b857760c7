package com.jsdesugar.tree;

import com.jsdesugar.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lists the direct children of a node in source order. Absent optional children
 * (a missing else branch, an array hole) are skipped.
 */
public final class NodeChildren implements NodeVisitor<List<Node>> {

    private static final NodeChildren INSTANCE = new NodeChildren();

    private NodeChildren() {
    }

    public static List<Node> of(Node node) {
        return node.accept(INSTANCE);
    }

    private static List<Node> children(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Node node) {
                        result.add(node);
                    }
                }
            }
        }
        return result;
    }

    // Program and statements

    @Override
    public List<Node> visitProgram(Program node) {
        return children(node.body());
    }

    @Override
    public List<Node> visitExpressionStatement(ExpressionStatement node) {
        return children(node.expression());
    }

    @Override
    public List<Node> visitBlockStatement(BlockStatement node) {
        return children(node.body());
    }

    @Override
    public List<Node> visitVariableDeclaration(VariableDeclaration node) {
        return children(node.declarations());
    }

    @Override
    public List<Node> visitVariableDeclarator(VariableDeclarator node) {
        return children(node.id(), node.init());
    }

    @Override
    public List<Node> visitReturnStatement(ReturnStatement node) {
        return children(node.argument());
    }

    @Override
    public List<Node> visitIfStatement(IfStatement node) {
        return children(node.test(), node.consequent(), node.alternate());
    }

    @Override
    public List<Node> visitForStatement(ForStatement node) {
        return children(node.init(), node.test(), node.update(), node.body());
    }

    @Override
    public List<Node> visitForOfStatement(ForOfStatement node) {
        return children(node.left(), node.right(), node.body());
    }

    @Override
    public List<Node> visitWhileStatement(WhileStatement node) {
        return children(node.test(), node.body());
    }

    @Override
    public List<Node> visitThrowStatement(ThrowStatement node) {
        return children(node.argument());
    }

    @Override
    public List<Node> visitFunctionDeclaration(FunctionDeclaration node) {
        return children(node.id(), node.params(), node.body());
    }

    @Override
    public List<Node> visitClassDeclaration(ClassDeclaration node) {
        return children(node.id(), node.superClass(), node.body());
    }

    @Override
    public List<Node> visitEmptyStatement(EmptyStatement node) {
        return Collections.emptyList();
    }

    // Expressions

    @Override
    public List<Node> visitIdentifier(Identifier node) {
        return Collections.emptyList();
    }

    @Override
    public List<Node> visitLiteral(Literal node) {
        return Collections.emptyList();
    }

    @Override
    public List<Node> visitThisExpression(ThisExpression node) {
        return Collections.emptyList();
    }

    @Override
    public List<Node> visitSuper(Super node) {
        return Collections.emptyList();
    }

    @Override
    public List<Node> visitMemberExpression(MemberExpression node) {
        return children(node.object(), node.property());
    }

    @Override
    public List<Node> visitCallExpression(CallExpression node) {
        return children(node.callee(), node.arguments());
    }

    @Override
    public List<Node> visitNewExpression(NewExpression node) {
        return children(node.callee(), node.arguments());
    }

    @Override
    public List<Node> visitAssignmentExpression(AssignmentExpression node) {
        return children(node.left(), node.right());
    }

    @Override
    public List<Node> visitUpdateExpression(UpdateExpression node) {
        return children(node.argument());
    }

    @Override
    public List<Node> visitBinaryExpression(BinaryExpression node) {
        return children(node.left(), node.right());
    }

    @Override
    public List<Node> visitLogicalExpression(LogicalExpression node) {
        return children(node.left(), node.right());
    }

    @Override
    public List<Node> visitUnaryExpression(UnaryExpression node) {
        return children(node.argument());
    }

    @Override
    public List<Node> visitConditionalExpression(ConditionalExpression node) {
        return children(node.test(), node.consequent(), node.alternate());
    }

    @Override
    public List<Node> visitArrowFunctionExpression(ArrowFunctionExpression node) {
        return children(node.params(), node.body());
    }

    @Override
    public List<Node> visitFunctionExpression(FunctionExpression node) {
        return children(node.id(), node.params(), node.body());
    }

    @Override
    public List<Node> visitObjectExpression(ObjectExpression node) {
        return children(node.properties());
    }

    @Override
    public List<Node> visitProperty(Property node) {
        // Shorthand {a} carries the same identifier as key and value
        if (node.shorthand()) {
            return children(node.value());
        }
        return children(node.key(), node.value());
    }

    @Override
    public List<Node> visitArrayExpression(ArrayExpression node) {
        return children(node.elements());
    }

    @Override
    public List<Node> visitChainExpression(ChainExpression node) {
        return children(node.expression());
    }

    @Override
    public List<Node> visitParenthesizedExpression(ParenthesizedExpression node) {
        return children(node.expression());
    }

    @Override
    public List<Node> visitAsExpression(AsExpression node) {
        return children(node.expression());
    }

    @Override
    public List<Node> visitSequenceExpression(SequenceExpression node) {
        return children(node.expressions());
    }

    @Override
    public List<Node> visitTemplateLiteral(TemplateLiteral node) {
        // Interleave quasis and expressions so the order matches the source text
        List<Node> result = new ArrayList<>();
        for (int i = 0; i < node.quasis().size(); i++) {
            result.add(node.quasis().get(i));
            if (i < node.expressions().size()) {
                result.add(node.expressions().get(i));
            }
        }
        return result;
    }

    @Override
    public List<Node> visitTemplateElement(TemplateElement node) {
        return Collections.emptyList();
    }

    @Override
    public List<Node> visitClassExpression(ClassExpression node) {
        return children(node.id(), node.superClass(), node.body());
    }

    @Override
    public List<Node> visitSpreadElement(SpreadElement node) {
        return children(node.argument());
    }

    // Patterns

    @Override
    public List<Node> visitObjectPattern(ObjectPattern node) {
        return children(node.properties());
    }

    @Override
    public List<Node> visitArrayPattern(ArrayPattern node) {
        return children(node.elements());
    }

    @Override
    public List<Node> visitAssignmentPattern(AssignmentPattern node) {
        return children(node.left(), node.right());
    }

    @Override
    public List<Node> visitRestElement(RestElement node) {
        return children(node.argument());
    }

    // Classes

    @Override
    public List<Node> visitClassBody(ClassBody node) {
        return children(node.body());
    }

    @Override
    public List<Node> visitMethodDefinition(MethodDefinition node) {
        return children(node.key(), node.value());
    }

    @Override
    public List<Node> visitPropertyDefinition(PropertyDefinition node) {
        return children(node.key(), node.value());
    }
}
