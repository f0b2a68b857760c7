package com.jsdesugar.diagnostics;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every reported diagnostic in order.
 */
public class CollectingReporter implements DiagnosticReporter {

    private final List<Diagnostic> diagnostics = new CopyOnWriteArrayList<>();

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::fatal);
    }
}
