package com.jsdesugar.tree;

import com.jsdesugar.ast.Node;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Child-to-parent links of one tree. AST records have no parent pointers and
 * compare by value, so the index is keyed on node identity.
 */
public final class ParentIndex {

    private final Node root;
    private final Map<Node, Node> parents;

    private ParentIndex(Node root, Map<Node, Node> parents) {
        this.root = root;
        this.parents = parents;
    }

    public static ParentIndex of(Node root) {
        Map<Node, Node> parents = new IdentityHashMap<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            for (Node child : NodeChildren.of(current)) {
                parents.put(child, current);
                pending.push(child);
            }
        }
        return new ParentIndex(root, Collections.unmodifiableMap(parents));
    }

    public Node root() {
        return root;
    }

    public Optional<Node> parentOf(Node node) {
        return Optional.ofNullable(parents.get(node));
    }

    /**
     * Whether the node belongs to the indexed tree.
     */
    public boolean contains(Node node) {
        return node == root || parents.containsKey(node);
    }
}
