package com.jsdesugar.symbols;

/**
 * The accessors found for one member access. Both absent means the member is not
 * accessor-backed.
 */
public record AccessorResolution(AccessorDeclaration getter, AccessorDeclaration setter) {

    public static final AccessorResolution NONE = new AccessorResolution(null, null);

    public boolean hasGetter() {
        return getter != null;
    }

    public boolean hasSetter() {
        return setter != null;
    }

    public boolean empty() {
        return getter == null && setter == null;
    }

    /**
     * The subset that uses may be rewritten against: only {@link Provenance#USER_CLASS}
     * declarations survive.
     */
    public AccessorResolution rewritable() {
        AccessorDeclaration keptGetter = getter != null && getter.rewritable() ? getter : null;
        AccessorDeclaration keptSetter = setter != null && setter.rewritable() ? setter : null;
        if (keptGetter == getter && keptSetter == setter) {
            return this;
        }
        return new AccessorResolution(keptGetter, keptSetter);
    }
}
