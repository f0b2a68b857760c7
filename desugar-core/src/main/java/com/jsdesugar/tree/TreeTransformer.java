package com.jsdesugar.tree;

import com.jsdesugar.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rebuilds a tree bottom-up. Every visit transforms the children of the node and
 * constructs a copy around them, keeping the original span; subclasses override
 * the visits for the kinds they rewrite.
 *
 * <p>The input tree is never modified. Visits always receive nodes of the input
 * tree, so subclasses can relate them to their input-tree ancestors.</p>
 */
public abstract class TreeTransformer implements NodeVisitor<Node> {

    /**
     * Transforms a single node; null stays null. The result type is inferred from
     * the slot it is stored in.
     */
    @SuppressWarnings("unchecked")
    protected <T extends Node> T transform(Node node) {
        if (node == null) {
            return null;
        }
        return (T) node.accept(this);
    }

    protected <T extends Node> List<T> transformAll(List<? extends Node> nodes) {
        List<T> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(transform(node));
        }
        return Collections.unmodifiableList(result);
    }

    // Program and statements

    @Override
    public Node visitProgram(Program node) {
        return new Program(node.span(), transformAll(node.body()), node.sourceType());
    }

    @Override
    public Node visitExpressionStatement(ExpressionStatement node) {
        return new ExpressionStatement(node.span(), transform(node.expression()));
    }

    @Override
    public Node visitBlockStatement(BlockStatement node) {
        return new BlockStatement(node.span(), transformAll(node.body()));
    }

    @Override
    public Node visitVariableDeclaration(VariableDeclaration node) {
        return new VariableDeclaration(node.span(), transformAll(node.declarations()), node.kind());
    }

    @Override
    public Node visitVariableDeclarator(VariableDeclarator node) {
        return new VariableDeclarator(node.span(), transform(node.id()), transform(node.init()));
    }

    @Override
    public Node visitReturnStatement(ReturnStatement node) {
        return new ReturnStatement(node.span(), transform(node.argument()));
    }

    @Override
    public Node visitIfStatement(IfStatement node) {
        return new IfStatement(node.span(),
            transform(node.test()),
            transform(node.consequent()),
            transform(node.alternate()));
    }

    @Override
    public Node visitForStatement(ForStatement node) {
        return new ForStatement(node.span(),
            transform(node.init()),
            transform(node.test()),
            transform(node.update()),
            transform(node.body()));
    }

    @Override
    public Node visitForOfStatement(ForOfStatement node) {
        return new ForOfStatement(node.span(),
            transform(node.left()),
            transform(node.right()),
            transform(node.body()),
            node.await());
    }

    @Override
    public Node visitWhileStatement(WhileStatement node) {
        return new WhileStatement(node.span(), transform(node.test()), transform(node.body()));
    }

    @Override
    public Node visitThrowStatement(ThrowStatement node) {
        return new ThrowStatement(node.span(), transform(node.argument()));
    }

    @Override
    public Node visitFunctionDeclaration(FunctionDeclaration node) {
        return new FunctionDeclaration(node.span(),
            transform(node.id()),
            transformAll(node.params()),
            transform(node.body()),
            node.generator(),
            node.async());
    }

    @Override
    public Node visitClassDeclaration(ClassDeclaration node) {
        return new ClassDeclaration(node.span(),
            transform(node.id()),
            transform(node.superClass()),
            transform(node.body()));
    }

    @Override
    public Node visitEmptyStatement(EmptyStatement node) {
        return new EmptyStatement(node.span());
    }

    // Expressions

    @Override
    public Node visitIdentifier(Identifier node) {
        return new Identifier(node.span(), node.name());
    }

    @Override
    public Node visitLiteral(Literal node) {
        return new Literal(node.span(), node.value(), node.raw());
    }

    @Override
    public Node visitThisExpression(ThisExpression node) {
        return new ThisExpression(node.span());
    }

    @Override
    public Node visitSuper(Super node) {
        return new Super(node.span());
    }

    @Override
    public Node visitMemberExpression(MemberExpression node) {
        return new MemberExpression(node.span(),
            transform(node.object()),
            transform(node.property()),
            node.computed(),
            node.optional());
    }

    @Override
    public Node visitCallExpression(CallExpression node) {
        return new CallExpression(node.span(),
            transform(node.callee()),
            transformAll(node.arguments()),
            node.optional());
    }

    @Override
    public Node visitNewExpression(NewExpression node) {
        return new NewExpression(node.span(), transform(node.callee()), transformAll(node.arguments()));
    }

    @Override
    public Node visitAssignmentExpression(AssignmentExpression node) {
        return new AssignmentExpression(node.span(),
            node.operator(),
            transform(node.left()),
            transform(node.right()));
    }

    @Override
    public Node visitUpdateExpression(UpdateExpression node) {
        return new UpdateExpression(node.span(), node.operator(), node.prefix(), transform(node.argument()));
    }

    @Override
    public Node visitBinaryExpression(BinaryExpression node) {
        return new BinaryExpression(node.span(),
            node.operator(),
            transform(node.left()),
            transform(node.right()));
    }

    @Override
    public Node visitLogicalExpression(LogicalExpression node) {
        return new LogicalExpression(node.span(),
            node.operator(),
            transform(node.left()),
            transform(node.right()));
    }

    @Override
    public Node visitUnaryExpression(UnaryExpression node) {
        return new UnaryExpression(node.span(), node.operator(), node.prefix(), transform(node.argument()));
    }

    @Override
    public Node visitConditionalExpression(ConditionalExpression node) {
        return new ConditionalExpression(node.span(),
            transform(node.test()),
            transform(node.consequent()),
            transform(node.alternate()));
    }

    @Override
    public Node visitArrowFunctionExpression(ArrowFunctionExpression node) {
        return new ArrowFunctionExpression(node.span(),
            transformAll(node.params()),
            transform(node.body()),
            node.expression(),
            node.async());
    }

    @Override
    public Node visitFunctionExpression(FunctionExpression node) {
        return new FunctionExpression(node.span(),
            transform(node.id()),
            transformAll(node.params()),
            transform(node.body()),
            node.generator(),
            node.async());
    }

    @Override
    public Node visitObjectExpression(ObjectExpression node) {
        return new ObjectExpression(node.span(), transformAll(node.properties()));
    }

    @Override
    public Node visitProperty(Property node) {
        Node value = transform(node.value());
        // A shorthand property keeps key and value as one identifier
        Expression key = node.shorthand() && value instanceof Identifier identifier
            ? identifier
            : transform(node.key());
        return new Property(node.span(),
            key,
            value,
            node.kind(),
            node.method(),
            node.shorthand(),
            node.computed());
    }

    @Override
    public Node visitArrayExpression(ArrayExpression node) {
        return new ArrayExpression(node.span(), transformAll(node.elements()));
    }

    @Override
    public Node visitChainExpression(ChainExpression node) {
        return new ChainExpression(node.span(), transform(node.expression()));
    }

    @Override
    public Node visitParenthesizedExpression(ParenthesizedExpression node) {
        return new ParenthesizedExpression(node.span(), transform(node.expression()));
    }

    @Override
    public Node visitAsExpression(AsExpression node) {
        return new AsExpression(node.span(), transform(node.expression()), node.typeAnnotation());
    }

    @Override
    public Node visitSequenceExpression(SequenceExpression node) {
        return new SequenceExpression(node.span(), transformAll(node.expressions()));
    }

    @Override
    public Node visitTemplateLiteral(TemplateLiteral node) {
        return new TemplateLiteral(node.span(), transformAll(node.quasis()), transformAll(node.expressions()));
    }

    @Override
    public Node visitTemplateElement(TemplateElement node) {
        return new TemplateElement(node.span(), node.value(), node.tail());
    }

    @Override
    public Node visitClassExpression(ClassExpression node) {
        return new ClassExpression(node.span(),
            transform(node.id()),
            transform(node.superClass()),
            transform(node.body()));
    }

    @Override
    public Node visitSpreadElement(SpreadElement node) {
        return new SpreadElement(node.span(), transform(node.argument()));
    }

    // Patterns

    @Override
    public Node visitObjectPattern(ObjectPattern node) {
        return new ObjectPattern(node.span(), transformAll(node.properties()));
    }

    @Override
    public Node visitArrayPattern(ArrayPattern node) {
        return new ArrayPattern(node.span(), transformAll(node.elements()));
    }

    @Override
    public Node visitAssignmentPattern(AssignmentPattern node) {
        return new AssignmentPattern(node.span(), transform(node.left()), transform(node.right()));
    }

    @Override
    public Node visitRestElement(RestElement node) {
        return new RestElement(node.span(), transform(node.argument()));
    }

    // Classes

    @Override
    public Node visitClassBody(ClassBody node) {
        return new ClassBody(node.span(), transformAll(node.body()));
    }

    @Override
    public Node visitMethodDefinition(MethodDefinition node) {
        return new MethodDefinition(node.span(),
            transform(node.key()),
            transform(node.value()),
            node.kind(),
            node.computed(),
            node.isStatic());
    }

    @Override
    public Node visitPropertyDefinition(PropertyDefinition node) {
        return new PropertyDefinition(node.span(),
            transform(node.key()),
            transform(node.value()),
            node.computed(),
            node.isStatic());
    }
}
