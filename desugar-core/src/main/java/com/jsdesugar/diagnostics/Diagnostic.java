package com.jsdesugar.diagnostics;

import com.jsdesugar.ast.Span;

import java.util.Locale;

/**
 * A message about one node of the program being desugared.
 */
public record Diagnostic(DiagnosticKind kind, String message, Span span) {

    public Diagnostic {
        if (span == null) {
            span = Span.NONE;
        }
    }

    public Severity severity() {
        return kind.severity();
    }

    public boolean fatal() {
        return kind.severity() == Severity.FATAL;
    }

    @Override
    public String toString() {
        int line = span.loc().start().line();
        String where = line > 0 ? line + ":" + span.loc().start().column() + ": " : "";
        return severity().name().toLowerCase(Locale.ROOT) + ": " + where + message;
    }
}
