package com.jsdesugar.symbols;

import com.jsdesugar.ast.MethodDefinition;
import com.jsdesugar.ast.Node;

/**
 * One declaration of a symbol.
 *
 * @param node  the declaring node; accessors are {@link MethodDefinition}s of kind get/set
 * @param site  the body the declaration appears in
 * @param owner the type declaring it
 */
public record Declaration(Node node, DeclarationSite site, TypeSymbol owner) {

    /**
     * The accessor kind of this declaration, or null if it is not a getter or setter.
     */
    public AccessorKind accessorKind() {
        if (node instanceof MethodDefinition method) {
            if (MethodDefinition.KIND_GET.equals(method.kind())) {
                return AccessorKind.GETTER;
            }
            if (MethodDefinition.KIND_SET.equals(method.kind())) {
                return AccessorKind.SETTER;
            }
        }
        return null;
    }
}
