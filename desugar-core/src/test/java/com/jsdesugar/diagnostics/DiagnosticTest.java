package com.jsdesugar.diagnostics;

import com.jsdesugar.ast.Span;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticTest {

    @Test
    void testSeverityComesFromKind() {
        assertTrue(new Diagnostic(DiagnosticKind.MISSING_GETTER_FOR_READ_MODIFY_WRITE, "m", Span.NONE).fatal());
        assertTrue(new Diagnostic(DiagnosticKind.UNSUPPORTED_DUPLICATE_EVALUATION_TARGET, "m", Span.NONE).fatal());
        assertFalse(new Diagnostic(DiagnosticKind.UNREWRITABLE_DESTRUCTURING_TARGET, "m", Span.NONE).fatal());
    }

    @Test
    void testToStringIncludesPosition() {
        Diagnostic located = new Diagnostic(DiagnosticKind.UNREWRITABLE_DESTRUCTURING_TARGET, "left unchanged",
            Span.of(4, 11, 3, 2, 3, 9));
        Diagnostic synthetic = new Diagnostic(DiagnosticKind.MISSING_GETTER_FOR_READ_MODIFY_WRITE, "no getter", null);

        assertEquals("info: 3:2: left unchanged", located.toString());
        assertEquals("fatal: no getter", synthetic.toString());
        assertEquals(Span.NONE, synthetic.span());
    }

    @Test
    void testSeverityIsLowercasedIndependentlyOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Diagnostic diagnostic = new Diagnostic(DiagnosticKind.UNREWRITABLE_DESTRUCTURING_TARGET, "kept", Span.NONE);
            assertEquals("info: kept", diagnostic.toString());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testCollectingReporterKeepsOrder() {
        CollectingReporter reporter = new CollectingReporter();

        reporter.report(DiagnosticKind.UNREWRITABLE_DESTRUCTURING_TARGET, "first", Span.NONE);
        assertFalse(reporter.hasFatal());
        reporter.report(DiagnosticKind.MISSING_GETTER_FOR_READ_MODIFY_WRITE, "second", Span.NONE);

        assertEquals(2, reporter.diagnostics().size());
        assertEquals("first", reporter.diagnostics().get(0).message());
        assertTrue(reporter.hasFatal());
    }

    @Test
    void testLoggingReporterAcceptsBothSeverities() {
        LoggingReporter reporter = new LoggingReporter("Main.ts");

        assertDoesNotThrow(() -> {
            reporter.report(DiagnosticKind.UNREWRITABLE_DESTRUCTURING_TARGET, "kept", Span.NONE);
            reporter.report(DiagnosticKind.MISSING_GETTER_FOR_READ_MODIFY_WRITE, "stopped", Span.NONE);
        });
    }
}
