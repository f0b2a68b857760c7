package com.jsdesugar.symbols;

/**
 * A named type as the type checker sees it.
 *
 * @param name          the type's name, unique within one oracle
 * @param hostIntrinsic true for the host environment's intrinsic base object type,
 *                      whose properties already have native accessor semantics at runtime
 */
public record TypeSymbol(String name, boolean hostIntrinsic) {

    public static TypeSymbol of(String name) {
        return new TypeSymbol(name, false);
    }

    public static TypeSymbol intrinsic(String name) {
        return new TypeSymbol(name, true);
    }
}
