package com.jsdesugar.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Literal,
    ThisExpression,
    Super,
    MemberExpression,
    CallExpression,
    NewExpression,
    AssignmentExpression,
    UpdateExpression,
    BinaryExpression,
    LogicalExpression,
    UnaryExpression,
    ConditionalExpression,
    ArrowFunctionExpression,
    FunctionExpression,
    ObjectExpression,
    ArrayExpression,
    ChainExpression,
    ParenthesizedExpression,
    AsExpression,
    SequenceExpression,
    TemplateLiteral,
    ClassExpression,
    SpreadElement {
}
