package de.bsommerfeld.nestedset.core.domain;

import java.util.List;

/**
 * A node with its children resolved, as produced from a flat pre-order scan.
 */
public record NodeTree(TreeNode node, List<NodeTree> children) {

    public NodeTree {
        children = List.copyOf(children);
    }

    /** Number of nodes in this subtree, including {@link #node()}. */
    public int size() {
        int size = 1;
        for (NodeTree child : children) {
            size += child.size();
        }
        return size;
    }
}
