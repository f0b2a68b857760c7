package com.jsdesugar;

import com.jsdesugar.ast.Program;
import com.jsdesugar.diagnostics.CollectingReporter;
import com.jsdesugar.diagnostics.DiagnosticReporter;
import com.jsdesugar.diagnostics.LoggingReporter;
import com.jsdesugar.rewrite.AccessorRewriteException;
import com.jsdesugar.rewrite.AccessorRewriter;
import com.jsdesugar.rewrite.RewriteContext;
import com.jsdesugar.rewrite.RewriteOptions;
import com.jsdesugar.symbols.AccessorClassifier;
import com.jsdesugar.symbols.SymbolOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the accessor desugaring pass.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * AccessorDesugarer desugarer = new AccessorDesugarer(oracle, RewriteOptions.defaults(), reporter);
 * RewriteResult result = desugarer.desugar(program);
 * if (result.succeeded()) {
 *     emit(result.orElseThrow());
 * }
 * }</pre>
 *
 * <p>Each call runs an independent traversal, so one instance may desugar several
 * programs concurrently as long as the oracle and reporter allow it.</p>
 */
public class AccessorDesugarer {

    private static final Logger log = LoggerFactory.getLogger(AccessorDesugarer.class);

    private final AccessorClassifier classifier;
    private final RewriteContext context;
    private final DiagnosticReporter reporter;

    public AccessorDesugarer(SymbolOracle oracle) {
        this(oracle, RewriteOptions.defaults(), new LoggingReporter());
    }

    public AccessorDesugarer(SymbolOracle oracle, RewriteOptions options, DiagnosticReporter reporter) {
        this.classifier = new AccessorClassifier(oracle);
        this.context = RewriteContext.of(options);
        this.reporter = reporter;
    }

    public RewriteOptions options() {
        return context.options();
    }

    /**
     * Desugars one program. A fatal condition is reported and ends the run without
     * output; the input program is never modified.
     */
    public RewriteResult desugar(Program program) {
        CollectingReporter collected = new CollectingReporter();
        DiagnosticReporter sink = diagnostic -> {
            collected.report(diagnostic);
            reporter.report(diagnostic);
        };
        try {
            Program rewritten = AccessorRewriter.rewrite(program, context, classifier, sink);
            return new RewriteResult.Rewritten(rewritten, collected.diagnostics());
        } catch (AccessorRewriteException e) {
            log.debug("Desugaring aborted", e);
            sink.report(e.diagnostic());
            return new RewriteResult.Aborted(e, collected.diagnostics());
        }
    }
}
