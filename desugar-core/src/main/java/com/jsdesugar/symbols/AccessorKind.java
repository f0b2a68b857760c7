package com.jsdesugar.symbols;

public enum AccessorKind {
    GETTER("get"),
    SETTER("set");

    private final String verb;

    AccessorKind(String verb) {
        this.verb = verb;
    }

    /**
     * The verb used in synthesized method names: {@code __getvalue}, {@code __setvalue}.
     */
    public String verb() {
        return verb;
    }
}
