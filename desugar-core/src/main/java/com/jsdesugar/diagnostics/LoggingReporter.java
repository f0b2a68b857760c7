package com.jsdesugar.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostics to the log: info as INFO, fatal as ERROR.
 */
public class LoggingReporter implements DiagnosticReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingReporter.class);

    private final String source;

    public LoggingReporter() {
        this("<input>");
    }

    /**
     * @param source name of the program being desugared, prefixed to every message
     */
    public LoggingReporter(String source) {
        this.source = source;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        if (diagnostic.fatal()) {
            log.error("{}: {}", source, diagnostic);
        } else {
            log.info("{}: {}", source, diagnostic);
        }
    }
}
