package com.jsdesugar.symbols;

import com.jsdesugar.ast.Node;

/**
 * A getter or setter that backs a member, tagged with its provenance.
 */
public record AccessorDeclaration(AccessorKind kind, TypeSymbol owner, Node payload, Provenance provenance) {

    public boolean rewritable() {
        return provenance == Provenance.USER_CLASS;
    }
}
