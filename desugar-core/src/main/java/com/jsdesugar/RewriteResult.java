package com.jsdesugar;

import com.jsdesugar.ast.Program;
import com.jsdesugar.diagnostics.Diagnostic;
import com.jsdesugar.rewrite.AccessorRewriteException;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of desugaring one program: either the rewritten program, or the fatal
 * diagnostic that stopped the run. Both carry every diagnostic reported on the way.
 */
public sealed interface RewriteResult permits RewriteResult.Rewritten, RewriteResult.Aborted {

    List<Diagnostic> diagnostics();

    /**
     * The rewritten program, empty if the run was aborted.
     */
    Optional<Program> output();

    default boolean succeeded() {
        return this instanceof Rewritten;
    }

    /**
     * Returns the rewritten program, or rethrows what aborted the run.
     */
    Program orElseThrow();

    record Rewritten(Program program, List<Diagnostic> diagnostics) implements RewriteResult {
        public Rewritten {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public Optional<Program> output() {
            return Optional.of(program);
        }

        @Override
        public Program orElseThrow() {
            return program;
        }
    }

    record Aborted(AccessorRewriteException cause, List<Diagnostic> diagnostics) implements RewriteResult {
        public Aborted {
            diagnostics = List.copyOf(diagnostics);
        }

        public Diagnostic fatal() {
            return cause.diagnostic();
        }

        @Override
        public Optional<Program> output() {
            return Optional.empty();
        }

        @Override
        public Program orElseThrow() {
            throw cause;
        }
    }
}
