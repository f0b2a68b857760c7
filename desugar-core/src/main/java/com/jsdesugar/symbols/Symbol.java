package com.jsdesugar.symbols;

import java.util.List;

/**
 * A resolved name with every declaration that contributes to it. A property with
 * both accessors has (at least) two declarations.
 */
public record Symbol(String name, List<Declaration> declarations) {

    public Symbol {
        declarations = List.copyOf(declarations);
    }
}
