package com.jsdesugar;

import com.jsdesugar.ast.Program;
import com.jsdesugar.diagnostics.DiagnosticReporter;
import com.jsdesugar.diagnostics.LoggingReporter;
import com.jsdesugar.rewrite.RewriteOptions;
import com.jsdesugar.symbols.SymbolOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Desugars several programs, one traversal each. A fatal condition aborts only the
 * program it occurs in; the others are still desugared.
 */
public class DesugarBatch {

    private static final Logger log = LoggerFactory.getLogger(DesugarBatch.class);

    /**
     * A program and the name diagnostics refer to it by (usually its file path).
     */
    public record Unit(String name, Program program) {}

    public record Outcome(String name, RewriteResult result) {}

    private final SymbolOracle oracle;
    private final RewriteOptions options;
    private final Function<String, DiagnosticReporter> reporters;

    public DesugarBatch(SymbolOracle oracle, RewriteOptions options) {
        this(oracle, options, LoggingReporter::new);
    }

    /**
     * @param reporters creates the reporter for a unit, given its name
     */
    public DesugarBatch(SymbolOracle oracle, RewriteOptions options, Function<String, DiagnosticReporter> reporters) {
        this.oracle = oracle;
        this.options = options;
        this.reporters = reporters;
    }

    /**
     * Desugars the units one after another on the calling thread.
     *
     * @return one outcome per unit, in input order
     */
    public List<Outcome> run(List<Unit> units) {
        List<Outcome> outcomes = new ArrayList<>(units.size());
        for (Unit unit : units) {
            outcomes.add(desugar(unit));
        }
        summarize(outcomes);
        return outcomes;
    }

    /**
     * Desugars the units on a pool of {@code threads} workers. The oracle must support
     * concurrent reads.
     *
     * @return one outcome per unit, in input order
     */
    public List<Outcome> run(List<Unit> units, int threads) {
        if (threads <= 1 || units.size() <= 1) {
            return run(units);
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, units.size()));
        try {
            List<Future<Outcome>> futures = new ArrayList<>(units.size());
            for (Unit unit : units) {
                futures.add(executor.submit(() -> desugar(unit)));
            }
            List<Outcome> outcomes = new ArrayList<>(units.size());
            for (Future<Outcome> future : futures) {
                outcomes.add(future.get());
            }
            summarize(outcomes);
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while desugaring", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Desugaring failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome desugar(Unit unit) {
        AccessorDesugarer desugarer = new AccessorDesugarer(oracle, options, reporters.apply(unit.name()));
        return new Outcome(unit.name(), desugarer.desugar(unit.program()));
    }

    private static void summarize(List<Outcome> outcomes) {
        long aborted = outcomes.stream().filter(outcome -> !outcome.result().succeeded()).count();
        log.info("Desugared {} program(s), {} aborted", outcomes.size(), aborted);
    }
}
