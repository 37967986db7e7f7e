package de.bsommerfeld.nestedset.db;

import de.bsommerfeld.nestedset.core.domain.NodeBounds;
import de.bsommerfeld.nestedset.core.domain.NodeTree;
import de.bsommerfeld.nestedset.core.domain.Ordering;
import de.bsommerfeld.nestedset.core.domain.TreeErrors;
import de.bsommerfeld.nestedset.core.domain.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Read-only questions about the tree, answered with bound comparisons only.
 *
 * <p>
 * Every method that takes a reference node re-reads that node's bounds from
 * storage first, so stale instances give correct answers. The reference node
 * itself must have been saved.
 *
 * <p>
 * Soft-deleted rows are hidden unless the query was obtained through
 * {@link #withSoftDeleted()}. {@link #countErrors()} always inspects every
 * row, since soft-deleted rows still hold bounds.
 */
public class TreeQuery {

    private final BoundsStore store;
    private final boolean includeSoftDeleted;

    public TreeQuery(BoundsStore store) {
        this(store, false);
    }

    public TreeQuery(BoundsStore store, boolean includeSoftDeleted) {
        this.store = store;
        this.includeSoftDeleted = includeSoftDeleted;
    }

    /** The same queries, including soft-deleted rows. */
    public TreeQuery withSoftDeleted() {
        return includeSoftDeleted ? this : new TreeQuery(store, true);
    }

    public boolean includesSoftDeleted() {
        return includeSoftDeleted;
    }

    // -- Lookup --

    public Optional<TreeNode> find(long id) {
        return store.find(id, includeSoftDeleted);
    }

    public List<TreeNode> all() {
        return all(Ordering.DEFAULT);
    }

    public List<TreeNode> all(Ordering ordering) {
        return store.select(NodeFilter.all(), includeSoftDeleted, ordering);
    }

    public List<TreeNode> roots() {
        return store.select(NodeFilter.childrenOf(null), includeSoftDeleted, Ordering.DEFAULT);
    }

    /** The first root in document order. */
    public Optional<TreeNode> root() {
        return first(roots());
    }

    // -- Vertical --

    public List<TreeNode> children(TreeNode node) {
        requirePersisted(node);
        return store.select(NodeFilter.childrenOf(node.getId()), includeSoftDeleted, Ordering.DEFAULT);
    }

    public Optional<TreeNode> parent(TreeNode node) {
        Long parentId = boundsOf(node).parentId();
        return parentId == null ? Optional.empty() : store.find(parentId, includeSoftDeleted);
    }

    /** All nodes strictly inside the node's interval, in document order. */
    public List<TreeNode> descendants(TreeNode node) {
        return descendants(node, Ordering.DEFAULT);
    }

    public List<TreeNode> descendants(TreeNode node, Ordering ordering) {
        return store.select(NodeFilter.descendantsOf(boundsOf(node)), includeSoftDeleted, ordering);
    }

    /** All nodes enclosing the node, root first. */
    public List<TreeNode> ancestors(TreeNode node) {
        return store.select(NodeFilter.ancestorsOf(boundsOf(node)), includeSoftDeleted, Ordering.DEFAULT);
    }

    public int descendantCount(TreeNode node) {
        return boundsOf(node).descendantCount();
    }

    /** Whether {@code node} lies strictly inside {@code other}, by stored bounds. */
    public boolean isDescendantOf(TreeNode node, TreeNode other) {
        return boundsOf(other).encloses(boundsOf(node).lft());
    }

    // -- Document order --

    /** Every node following the node's subtree, at any depth, nearest first. */
    public List<TreeNode> after(TreeNode node) {
        return store.select(NodeFilter.after(boundsOf(node)), includeSoftDeleted, Ordering.DEFAULT);
    }

    /** Every node ending before the node starts, at any depth, nearest first. */
    public List<TreeNode> before(TreeNode node) {
        return store.select(NodeFilter.before(boundsOf(node)), includeSoftDeleted, Ordering.REVERSED);
    }

    public Optional<TreeNode> next(TreeNode node) {
        return first(after(node));
    }

    public Optional<TreeNode> prev(TreeNode node) {
        return first(before(node));
    }

    // -- Siblings --

    public List<TreeNode> siblings(TreeNode node) {
        return store.select(NodeFilter.siblingsOf(node.getId(), boundsOf(node)), includeSoftDeleted,
                Ordering.DEFAULT);
    }

    /** Siblings after the node, nearest first. */
    public List<TreeNode> nextSiblings(TreeNode node) {
        return store.select(NodeFilter.nextSiblingsOf(boundsOf(node)), includeSoftDeleted, Ordering.DEFAULT);
    }

    /** Siblings before the node, nearest first. */
    public List<TreeNode> prevSiblings(TreeNode node) {
        return store.select(NodeFilter.prevSiblingsOf(boundsOf(node)), includeSoftDeleted, Ordering.REVERSED);
    }

    public Optional<TreeNode> nextSibling(TreeNode node) {
        return first(nextSiblings(node));
    }

    public Optional<TreeNode> prevSibling(TreeNode node) {
        return first(prevSiblings(node));
    }

    // -- Whole tree --

    /**
     * Resolves the flat pre-order listing into nested {@link NodeTree}s, one
     * per root. Each node hangs below the nearest node enclosing it.
     */
    public List<NodeTree> tree() {
        List<TreeNode> nodes = all(Ordering.DEFAULT);

        List<Builder> roots = new ArrayList<>();
        Deque<Builder> path = new ArrayDeque<>();
        for (TreeNode node : nodes) {
            while (!path.isEmpty() && path.peek().node.getRgt() < node.getLft()) {
                path.pop();
            }
            Builder builder = new Builder(node);
            if (path.isEmpty()) {
                roots.add(builder);
            } else {
                path.peek().children.add(builder);
            }
            path.push(builder);
        }

        List<NodeTree> result = new ArrayList<>(roots.size());
        for (Builder root : roots) {
            result.add(root.build());
        }
        return result;
    }

    private static final class Builder {
        private final TreeNode node;
        private final List<Builder> children = new ArrayList<>();

        private Builder(TreeNode node) {
            this.node = node;
        }

        private NodeTree build() {
            List<NodeTree> built = new ArrayList<>(children.size());
            for (Builder child : children) {
                built.add(child.build());
            }
            return new NodeTree(node, built);
        }
    }

    // -- Diagnostics --

    public TreeErrors countErrors() {
        return store.countErrors(true);
    }

    public int totalErrors() {
        return countErrors().total();
    }

    public boolean isBroken() {
        return countErrors().isBroken();
    }

    // -- Helpers --

    private NodeBounds boundsOf(TreeNode node) {
        requirePersisted(node);
        return store.loadBounds(node.getId()).orElseThrow(() -> new NodeNotFoundException(node.getId()));
    }

    private static void requirePersisted(TreeNode node) {
        if (!node.isPersisted()) {
            throw new IllegalStateException("Cannot query relative to a node that was never saved.");
        }
    }

    private static Optional<TreeNode> first(List<TreeNode> nodes) {
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }
}
