package com.jsdesugar.ast;

/**
 * Source range of a node: character offsets plus the matching line/column location.
 * Synthesized nodes that have no source text of their own use {@link #NONE}.
 */
public record Span(int start, int end, SourceLocation loc) {
    public static final Span NONE = new Span(0, 0, SourceLocation.NONE);

    public static Span of(int start, int end, int startLine, int startCol, int endLine, int endCol) {
        return new Span(start, end, new SourceLocation(
            new SourceLocation.Position(startLine, startCol),
            new SourceLocation.Position(endLine, endCol)
        ));
    }
}
