package com.jsdesugar.rewrite;

import com.jsdesugar.symbols.AccessorKind;

import java.util.regex.Pattern;

/**
 * Options of one desugaring run.
 *
 * @param namePrefix prepended to every synthesized accessor method name; a getter
 *                   {@code value} becomes {@code namePrefix + "get" + "value"}
 */
public record RewriteOptions(String namePrefix) {

    public static final String DEFAULT_PREFIX = "__";

    private static final Pattern IDENTIFIER_FRAGMENT = Pattern.compile("([A-Za-z_$][A-Za-z0-9_$]*)?");

    public RewriteOptions {
        if (namePrefix == null) {
            namePrefix = DEFAULT_PREFIX;
        }
        if (!IDENTIFIER_FRAGMENT.matcher(namePrefix).matches()) {
            throw new IllegalArgumentException("Name prefix '" + namePrefix + "' cannot start an identifier");
        }
    }

    public static RewriteOptions defaults() {
        return new RewriteOptions(DEFAULT_PREFIX);
    }

    /**
     * The synthesized method name for one accessor of a member, e.g. {@code __getvalue}.
     */
    public String methodName(AccessorKind kind, String memberName) {
        return namePrefix + kind.verb() + memberName;
    }
}
