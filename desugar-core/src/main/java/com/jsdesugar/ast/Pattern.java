package com.jsdesugar.ast;

public sealed interface Pattern extends Node permits Identifier, MemberExpression, ObjectPattern, ArrayPattern, AssignmentPattern, RestElement {
}
