package com.jsdesugar.symbols;

import com.jsdesugar.ast.Expression;
import com.jsdesugar.ast.Node;

import java.util.List;
import java.util.Optional;

/**
 * Name resolution and type queries answered by the front end that parsed and
 * type-checked the program. This is the only place that knows about the source
 * language's type system.
 *
 * <p>Implementations must be safe for concurrent reads if programs are desugared
 * in parallel.</p>
 */
public interface SymbolOracle {

    /**
     * The symbol a node refers to (for a member access, the accessed member; for a
     * declaration, the declared member).
     */
    Optional<Symbol> symbolAt(Node node);

    /**
     * The static type of an expression.
     */
    Optional<TypeSymbol> typeOf(Expression expression);

    /**
     * The property of a type with the given name, including inherited ones.
     */
    Optional<Symbol> propertyOf(TypeSymbol type, String name);

    /**
     * The types a type directly extends or implements.
     */
    List<TypeSymbol> baseTypesOf(TypeSymbol type);

    /**
     * Whether the declaration's source lies outside the compilation unit being
     * desugared, e.g. in a dependency's declaration files.
     */
    boolean isFromDependency(Declaration declaration);
}
