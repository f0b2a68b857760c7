package com.jsdesugar.ast;

public sealed interface Statement extends Node permits
    ExpressionStatement,
    BlockStatement,
    VariableDeclaration,
    ReturnStatement,
    IfStatement,
    ForStatement,
    ForOfStatement,
    WhileStatement,
    ThrowStatement,
    FunctionDeclaration,
    ClassDeclaration,
    EmptyStatement {
}
