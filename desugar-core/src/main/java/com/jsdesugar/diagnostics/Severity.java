package com.jsdesugar.diagnostics;

public enum Severity {
    INFO,
    /** The run cannot produce sound output and stops after reporting. */
    FATAL
}
