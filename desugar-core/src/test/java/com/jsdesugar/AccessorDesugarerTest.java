package com.jsdesugar;

import com.jsdesugar.ast.ClassDeclaration;
import com.jsdesugar.ast.Program;
import com.jsdesugar.diagnostics.CollectingReporter;
import com.jsdesugar.diagnostics.Diagnostic;
import com.jsdesugar.diagnostics.DiagnosticKind;
import com.jsdesugar.diagnostics.NodeText;
import com.jsdesugar.rewrite.DuplicateEvaluationException;
import com.jsdesugar.rewrite.MissingGetterException;
import com.jsdesugar.rewrite.RewriteOptions;
import com.jsdesugar.symbols.TypeSymbol;
import com.jsdesugar.testing.TestOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jsdesugar.testing.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class AccessorDesugarerTest {

    private static final TypeSymbol BOX = TypeSymbol.of("Box");
    private static final TypeSymbol SINK = TypeSymbol.of("Sink");

    private ClassDeclaration box;
    private ClassDeclaration sink;
    private TestOracle oracle;
    private CollectingReporter reporter;
    private AccessorDesugarer desugarer;

    @BeforeEach
    void setUp() {
        box = classDecl("Box",
            getter("value", ret(member(self(), "_v"))),
            setter("value", "v", stmt(assign(member(self(), "_v"), id("v")))));
        sink = classDecl("Sink", setter("level", "v"));
        oracle = new TestOracle()
            .declareClass(BOX, box)
            .declareClass(SINK, sink)
            .variable("a", BOX)
            .variable("s", SINK);
        reporter = new CollectingReporter();
        desugarer = new AccessorDesugarer(oracle, RewriteOptions.defaults(), reporter);
    }

    @Test
    void testSuccessfulRun() {
        Program program = program(box,
            let("a", newExpr("Box")),
            stmt(assign(member("a", "value"), num(5))),
            stmt(assign(id("x"), member("a", "value"))),
            stmt(assign("+=", member("a", "value"), num(1))),
            stmt(postfix("++", member("a", "value"))));

        RewriteResult result = desugarer.desugar(program);

        assertTrue(result.succeeded());
        assertEquals(String.join("\n",
            "class Box { __getvalue() { return this._v; } __setvalue(v) { this._v = v; } }",
            "let a = new Box();",
            "a.__setvalue(5);",
            "x = a.__getvalue();",
            "a.__setvalue(a.__getvalue() + 1);",
            "a.__setvalue(a.__getvalue() + 1);"), NodeText.of(result.orElseThrow()));
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void testMissingGetterAbortsWithFatalLast() {
        Program program = program(sink,
            stmt(assign(arrayPattern(member("a", "value")), id("pair"))),
            stmt(assign("+=", member("s", "level"), num(1))));

        RewriteResult result = desugarer.desugar(program);

        assertFalse(result.succeeded());
        assertTrue(result.output().isEmpty());
        RewriteResult.Aborted aborted = (RewriteResult.Aborted) result;
        assertEquals(DiagnosticKind.MISSING_GETTER_FOR_READ_MODIFY_WRITE, aborted.fatal().kind());

        List<Diagnostic> diagnostics = result.diagnostics();
        assertEquals(2, diagnostics.size());
        assertEquals(DiagnosticKind.UNREWRITABLE_DESTRUCTURING_TARGET, diagnostics.get(0).kind());
        assertSame(aborted.fatal(), diagnostics.get(1));
        assertEquals(diagnostics, reporter.diagnostics());
        assertThrows(MissingGetterException.class, result::orElseThrow);
    }

    @Test
    void testDuplicateEvaluationAborts() {
        Program program = program(stmt(postfix("--", member(newExpr("Box"), "value"))));

        RewriteResult result = desugarer.desugar(program);

        assertThrows(DuplicateEvaluationException.class, result::orElseThrow);
        assertTrue(reporter.hasFatal());
    }

    @Test
    void testAbortLeavesInputUntouched() {
        Program program = program(sink, stmt(postfix("++", member("s", "level"))));
        String before = NodeText.of(program);

        desugarer.desugar(program);

        assertEquals(before, NodeText.of(program));
    }

    @Test
    void testRunsAreIndependent() {
        Program failing = program(stmt(assign("*=", member("s", "level"), num(2))));
        Program passing = program(stmt(member("a", "value")));

        assertFalse(desugarer.desugar(failing).succeeded());
        RewriteResult result = desugarer.desugar(passing);

        assertTrue(result.succeeded());
        assertTrue(result.diagnostics().isEmpty());
        assertEquals("a.__getvalue();", NodeText.of(result.orElseThrow()));
    }

    @Test
    void testDefaultsUseDoubleUnderscore() {
        AccessorDesugarer defaults = new AccessorDesugarer(oracle);

        assertEquals("__", defaults.options().namePrefix());
        assertEquals("a.__getvalue();", NodeText.of(defaults.desugar(program(stmt(member("a", "value")))).orElseThrow()));
    }
}
