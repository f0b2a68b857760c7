package com.jsdesugar.rewrite;

import com.jsdesugar.diagnostics.Diagnostic;

/**
 * Raised when a program contains accessor syntax that cannot be desugared soundly.
 * It ends the whole run: any partial output would call methods that do not exist
 * or repeat side effects.
 */
public abstract class AccessorRewriteException extends RuntimeException {

    private final Diagnostic diagnostic;

    protected AccessorRewriteException(Diagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }
}
