package com.jsdesugar.symbols;

import com.jsdesugar.ast.MemberExpression;
import com.jsdesugar.ast.MethodDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Finds the getter and setter declarations behind a member access and decides
 * whether uses of them may be rewritten into method calls.
 *
 * <p>Only accessors declared in concrete class bodies count. Interface and ambient
 * declarations describe a contract and have no synthesized method behind them.
 * Accessors coming from dependencies, or owned by a type that is or derives from
 * the host's intrinsic base object type, keep native accessor semantics at
 * runtime and are tagged {@link Provenance#EXTERNAL_DEPENDENCY}.</p>
 *
 * <p>Results depend only on the oracle's answers, never on traversal order.</p>
 */
public class AccessorClassifier {

    private static final Logger log = LoggerFactory.getLogger(AccessorClassifier.class);

    private final SymbolOracle oracle;

    public AccessorClassifier(SymbolOracle oracle) {
        this.oracle = oracle;
    }

    /**
     * Resolves the accessors backing a dotted member access. Computed and private
     * accesses are never accessor-backed.
     */
    public AccessorResolution resolveAccessors(MemberExpression node) {
        String name = node.propertyName();
        if (name == null) {
            return AccessorResolution.NONE;
        }

        List<Declaration> direct = oracle.symbolAt(node)
            .map(AccessorClassifier::accessorDeclarations)
            .orElse(List.of());
        List<Declaration> concrete = atSite(direct, DeclarationSite.CLASS);
        if (!concrete.isEmpty()) {
            return classify(concrete);
        }

        // The symbol at the access may lack the declarations, e.g. when reached
        // through a supertype; ask the static type of the target instead
        List<Declaration> viaType = oracle.typeOf(node.object())
            .flatMap(type -> oracle.propertyOf(type, name))
            .map(AccessorClassifier::accessorDeclarations)
            .orElse(List.of());
        concrete = atSite(viaType, DeclarationSite.CLASS);
        if (!concrete.isEmpty()) {
            log.debug("Resolved '{}' through the type of its target", name);
            return classify(concrete);
        }

        List<Declaration> contracts = new ArrayList<>(atSite(direct, DeclarationSite.INTERFACE, DeclarationSite.AMBIENT));
        contracts.addAll(atSite(viaType, DeclarationSite.INTERFACE, DeclarationSite.AMBIENT));
        if (contracts.isEmpty()) {
            return AccessorResolution.NONE;
        }
        log.debug("'{}' is only declared by interfaces or ambient declarations", name);
        return group(contracts, declaration -> Provenance.INTERFACE_OR_AMBIENT);
    }

    /**
     * Whether an accessor declared in the program belongs to a type whose accessors
     * stay native: one from a dependency, or one deriving from the host intrinsic
     * base object type. Unknown declarations are treated as user code.
     */
    public boolean hasNativeAccessorOwner(MethodDefinition definition) {
        Optional<Declaration> declaration = oracle.symbolAt(definition)
            .flatMap(symbol -> symbol.declarations().stream()
                .filter(candidate -> candidate.node() == definition)
                .findFirst());
        return declaration.map(this::provenanceOf)
            .map(provenance -> provenance == Provenance.EXTERNAL_DEPENDENCY)
            .orElse(false);
    }

    private AccessorResolution classify(List<Declaration> declarations) {
        return group(declarations, this::provenanceOf);
    }

    private Provenance provenanceOf(Declaration declaration) {
        if (oracle.isFromDependency(declaration) || derivesFromHostIntrinsic(declaration.owner())) {
            return Provenance.EXTERNAL_DEPENDENCY;
        }
        return Provenance.USER_CLASS;
    }

    private boolean derivesFromHostIntrinsic(TypeSymbol type) {
        if (type == null) {
            return false;
        }
        Set<TypeSymbol> seen = new HashSet<>();
        Deque<TypeSymbol> pending = new ArrayDeque<>();
        pending.add(type);
        while (!pending.isEmpty()) {
            TypeSymbol current = pending.poll();
            if (!seen.add(current)) {
                continue;
            }
            if (current.hostIntrinsic()) {
                return true;
            }
            pending.addAll(oracle.baseTypesOf(current));
        }
        return false;
    }

    // First declaration of each kind wins; a member has at most one of each per owner
    private static AccessorResolution group(List<Declaration> declarations, Function<Declaration, Provenance> rule) {
        AccessorDeclaration getter = null;
        AccessorDeclaration setter = null;
        for (Declaration declaration : declarations) {
            AccessorKind kind = declaration.accessorKind();
            if (kind == AccessorKind.GETTER && getter == null) {
                getter = new AccessorDeclaration(kind, declaration.owner(), declaration.node(), rule.apply(declaration));
            } else if (kind == AccessorKind.SETTER && setter == null) {
                setter = new AccessorDeclaration(kind, declaration.owner(), declaration.node(), rule.apply(declaration));
            }
        }
        return new AccessorResolution(getter, setter);
    }

    private static List<Declaration> accessorDeclarations(Symbol symbol) {
        List<Declaration> result = new ArrayList<>();
        for (Declaration declaration : symbol.declarations()) {
            if (declaration.accessorKind() != null) {
                result.add(declaration);
            }
        }
        return result;
    }

    private static List<Declaration> atSite(List<Declaration> declarations, DeclarationSite... sites) {
        List<Declaration> result = new ArrayList<>();
        for (Declaration declaration : declarations) {
            for (DeclarationSite site : sites) {
                if (declaration.site() == site) {
                    result.add(declaration);
                    break;
                }
            }
        }
        return result;
    }
}
