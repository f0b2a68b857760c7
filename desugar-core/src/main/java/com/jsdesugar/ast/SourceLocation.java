package com.jsdesugar.ast;

/**
 * Line/column range of a node. Lines are 1-based, columns 0-based, as in ESTree.
 */
public record SourceLocation(Position start, Position end) {
    public static final SourceLocation NONE = new SourceLocation(new Position(0, 0), new Position(0, 0));

    public record Position(int line, int column) {}
}
