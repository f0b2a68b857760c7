package com.jsdesugar.symbols;

/**
 * The kind of body a declaration appears in.
 */
public enum DeclarationSite {
    /** A concrete class body, the only site whose accessors become real methods. */
    CLASS,
    /** An interface body. */
    INTERFACE,
    /** An ambient ({@code declare}) class or module. */
    AMBIENT,
    /** Anything else: object literals, variables, parameters. */
    OTHER
}
