package com.jsdesugar.symbols;

/**
 * Where an accessor declaration comes from, which decides whether uses of it can be
 * rewritten into calls.
 */
public enum Provenance {
    /** Declared in a concrete class of the code being compiled. Rewritable. */
    USER_CLASS,
    /** Declared only by an interface or ambient declaration: a contract with no method behind it. */
    INTERFACE_OR_AMBIENT,
    /** Declared by a dependency, or by a type that has native accessors at runtime. */
    EXTERNAL_DEPENDENCY
}
