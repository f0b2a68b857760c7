package com.jsdesugar.diagnostics;

import com.jsdesugar.ast.Span;

/**
 * Sink for diagnostics. A fatal diagnostic is always the last one reported for a run.
 */
@FunctionalInterface
public interface DiagnosticReporter {

    void report(Diagnostic diagnostic);

    default void report(DiagnosticKind kind, String message, Span span) {
        report(new Diagnostic(kind, message, span));
    }
}
