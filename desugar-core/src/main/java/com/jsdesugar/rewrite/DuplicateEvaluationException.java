package com.jsdesugar.rewrite;

import com.jsdesugar.diagnostics.Diagnostic;

/**
 * A read-modify-write target contains a {@code new} expression. The desugared form
 * evaluates the target for both the getter and the setter call, which would
 * construct the object twice.
 */
public class DuplicateEvaluationException extends AccessorRewriteException {

    public DuplicateEvaluationException(Diagnostic diagnostic) {
        super(diagnostic);
    }
}
