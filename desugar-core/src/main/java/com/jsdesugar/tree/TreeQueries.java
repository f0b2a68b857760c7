package com.jsdesugar.tree;

import com.jsdesugar.ast.AsExpression;
import com.jsdesugar.ast.Expression;
import com.jsdesugar.ast.Node;
import com.jsdesugar.ast.ParenthesizedExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ancestor, descendant and containment searches over the AST.
 *
 * <p>Descendant searches are pre-order and depth-first, visiting children in
 * source order, so results are deterministic. The node a search starts from is
 * never one of its own descendants.</p>
 */
public final class TreeQueries {

    private TreeQueries() {
        // Utility class
    }

    /**
     * Parenthesized expressions and {@code as} casts change neither the value nor
     * its identity at runtime.
     */
    public static boolean isTransparentWrapper(Node node) {
        return node instanceof ParenthesizedExpression || node instanceof AsExpression;
    }

    /**
     * Strips any number of transparent wrappers: {@code ((x as T))} yields {@code x}.
     */
    public static Node unwrap(Node node) {
        Node current = node;
        while (true) {
            if (current instanceof ParenthesizedExpression parenthesized) {
                current = parenthesized.expression();
            } else if (current instanceof AsExpression as) {
                current = as.expression();
            } else {
                return current;
            }
        }
    }

    private static Expression wrapped(Node wrapper) {
        if (wrapper instanceof ParenthesizedExpression parenthesized) {
            return parenthesized.expression();
        }
        if (wrapper instanceof AsExpression as) {
            return as.expression();
        }
        return null;
    }

    /**
     * Looks for a matching ancestor directly above the node, looking through
     * transparent wrappers that have the node (or a wrapper of it) as their
     * sub-expression. For {@code (x as T).p} the parent of {@code x} is found as if
     * the source were {@code x.p}. The walk stops at the first parent that neither
     * matches nor is such a wrapper.
     *
     * @return the matching ancestor, or empty if there is none
     */
    public static Optional<Node> findAncestorMatching(ParentIndex parents, Node node, Predicate<? super Node> predicate) {
        Node current = node;
        Optional<Node> parent = parents.parentOf(current);
        while (parent.isPresent()) {
            Node candidate = parent.get();
            if (predicate.test(candidate)) {
                return parent;
            }
            if (isTransparentWrapper(candidate) && wrapped(candidate) == current) {
                current = candidate;
                parent = parents.parentOf(current);
                continue;
            }
            break;
        }
        return Optional.empty();
    }

    /**
     * Walks all the way up from the node and returns the nearest ancestor that matches.
     */
    public static Optional<Node> findEnclosing(ParentIndex parents, Node node, Predicate<? super Node> predicate) {
        Optional<Node> parent = parents.parentOf(node);
        while (parent.isPresent()) {
            if (predicate.test(parent.get())) {
                return parent;
            }
            parent = parents.parentOf(parent.get());
        }
        return Optional.empty();
    }

    public static Optional<Node> findFirstDescendantMatching(Node node, Predicate<? super Node> predicate) {
        for (Node child : NodeChildren.of(node)) {
            if (predicate.test(child)) {
                return Optional.of(child);
            }
            Optional<Node> found = findFirstDescendantMatching(child, predicate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public static List<Node> findAllDescendantsMatching(Node node, Predicate<? super Node> predicate) {
        List<Node> matches = new ArrayList<>();
        collect(node, predicate, matches);
        return matches;
    }

    private static void collect(Node node, Predicate<? super Node> predicate, List<Node> matches) {
        for (Node child : NodeChildren.of(node)) {
            if (predicate.test(child)) {
                matches.add(child);
            }
            collect(child, predicate, matches);
        }
    }

    /**
     * Whether {@code node} (by identity) lies strictly below {@code ancestor}.
     */
    public static boolean isDescendantOf(Node ancestor, Node node) {
        return findFirstDescendantMatching(ancestor, candidate -> candidate == node).isPresent();
    }

    /**
     * Whether the node itself or anything below it matches.
     */
    public static boolean subtreeContains(Node node, Predicate<? super Node> predicate) {
        return predicate.test(node) || findFirstDescendantMatching(node, predicate).isPresent();
    }
}
