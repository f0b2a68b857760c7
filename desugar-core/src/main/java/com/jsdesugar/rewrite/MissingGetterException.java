package com.jsdesugar.rewrite;

import com.jsdesugar.diagnostics.Diagnostic;

/**
 * A compound assignment or increment/decrement writes a member that has a setter
 * but no getter to read the current value from.
 */
public class MissingGetterException extends AccessorRewriteException {

    public MissingGetterException(Diagnostic diagnostic) {
        super(diagnostic);
    }
}
