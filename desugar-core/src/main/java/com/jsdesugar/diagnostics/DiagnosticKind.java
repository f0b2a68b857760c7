package com.jsdesugar.diagnostics;

public enum DiagnosticKind {
    /** A compound assignment or increment/decrement targets a member that has a setter but no getter. */
    MISSING_GETTER_FOR_READ_MODIFY_WRITE(Severity.FATAL),
    /** A read-modify-write target contains a {@code new} expression, which would be evaluated twice. */
    UNSUPPORTED_DUPLICATE_EVALUATION_TARGET(Severity.FATAL),
    /** An accessor-backed member is assigned through destructuring and was left as written. */
    UNREWRITABLE_DESTRUCTURING_TARGET(Severity.INFO);

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
