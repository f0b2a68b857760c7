package com.jsdesugar.rewrite;

/**
 * Read-only state shared by a whole traversal.
 */
public record RewriteContext(RewriteOptions options, NodeFactory factory) {

    public static RewriteContext of(RewriteOptions options) {
        return new RewriteContext(options, new NodeFactory());
    }
}
