package com.jsdesugar.ast;

/**
 * Visitor over the closed set of node kinds. Adding a node kind adds a method here,
 * so every visitor has to decide what to do with it.
 *
 * @param <R> result type of a visit
 */
public interface NodeVisitor<R> {
    // Program and statements
    R visitProgram(Program node);
    R visitExpressionStatement(ExpressionStatement node);
    R visitBlockStatement(BlockStatement node);
    R visitVariableDeclaration(VariableDeclaration node);
    R visitVariableDeclarator(VariableDeclarator node);
    R visitReturnStatement(ReturnStatement node);
    R visitIfStatement(IfStatement node);
    R visitForStatement(ForStatement node);
    R visitForOfStatement(ForOfStatement node);
    R visitWhileStatement(WhileStatement node);
    R visitThrowStatement(ThrowStatement node);
    R visitFunctionDeclaration(FunctionDeclaration node);
    R visitClassDeclaration(ClassDeclaration node);
    R visitEmptyStatement(EmptyStatement node);

    // Expressions
    R visitIdentifier(Identifier node);
    R visitLiteral(Literal node);
    R visitThisExpression(ThisExpression node);
    R visitSuper(Super node);
    R visitMemberExpression(MemberExpression node);
    R visitCallExpression(CallExpression node);
    R visitNewExpression(NewExpression node);
    R visitAssignmentExpression(AssignmentExpression node);
    R visitUpdateExpression(UpdateExpression node);
    R visitBinaryExpression(BinaryExpression node);
    R visitLogicalExpression(LogicalExpression node);
    R visitUnaryExpression(UnaryExpression node);
    R visitConditionalExpression(ConditionalExpression node);
    R visitArrowFunctionExpression(ArrowFunctionExpression node);
    R visitFunctionExpression(FunctionExpression node);
    R visitObjectExpression(ObjectExpression node);
    R visitProperty(Property node);
    R visitArrayExpression(ArrayExpression node);
    R visitChainExpression(ChainExpression node);
    R visitParenthesizedExpression(ParenthesizedExpression node);
    R visitAsExpression(AsExpression node);
    R visitSequenceExpression(SequenceExpression node);
    R visitTemplateLiteral(TemplateLiteral node);
    R visitTemplateElement(TemplateElement node);
    R visitClassExpression(ClassExpression node);
    R visitSpreadElement(SpreadElement node);

    // Patterns
    R visitObjectPattern(ObjectPattern node);
    R visitArrayPattern(ArrayPattern node);
    R visitAssignmentPattern(AssignmentPattern node);
    R visitRestElement(RestElement node);

    // Classes
    R visitClassBody(ClassBody node);
    R visitMethodDefinition(MethodDefinition node);
    R visitPropertyDefinition(PropertyDefinition node);
}
