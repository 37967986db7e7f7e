package de.bsommerfeld.nestedset.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.nestedset.core.config.TreeConfig;
import de.bsommerfeld.nestedset.core.domain.MutationIntent;
import de.bsommerfeld.nestedset.core.domain.MutationResult;
import de.bsommerfeld.nestedset.core.domain.NodeBounds;
import de.bsommerfeld.nestedset.core.domain.NodeSpec;
import de.bsommerfeld.nestedset.core.domain.NodeTree;
import de.bsommerfeld.nestedset.core.domain.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single point of access to one nested set tree.
 *
 * <p>
 * Callers never talk to {@link BoundsStore}, {@link TreeMutator} or
 * {@link PendingActionQueue} directly; this class puts them in the right
 * order inside one transaction per call:
 *
 * <pre>
 *   save(node)
 *     └─ transaction
 *          ├─ PendingActionQueue.dispatch  → TreeMutator → GapAllocator → BoundsStore
 *          └─ row write (insert / update)
 * </pre>
 *
 * <h3>Failure semantics</h3>
 * If anything inside the transaction throws, the store rolls back every bound
 * shift and the node instance gets its previous id, bounds and parent back.
 * The pending intent stays consumed; the caller has to request it again.
 *
 * <h3>Soft delete</h3>
 * With {@code soft-delete} enabled in {@link TreeConfig}, {@link #delete}
 * only stamps {@code deleted_at}. The row keeps its bounds so the numbering
 * stays gap-free, and all maintenance reads still see it.
 */
@Singleton
public class NestedSetRepository {

    private static final Logger LOG = LoggerFactory.getLogger(NestedSetRepository.class);

    private final BoundsStore store;
    private final TreeSession session;
    private final TreeMutator mutator;
    private final PendingActionQueue actions;
    private final TreeQuery query;

    @Inject
    public NestedSetRepository(BoundsStore store, TreeConfig config) {
        this(store, config.isSoftDelete());
    }

    public NestedSetRepository(BoundsStore store, boolean softDelete) {
        this.store = store;
        this.session = new TreeSession(softDelete);
        this.mutator = new TreeMutator(store, new GapAllocator(store));
        this.actions = new PendingActionQueue(mutator);
        this.query = new TreeQuery(store);
        LOG.info("Nested set repository ready (soft delete: {})", softDelete);
    }

    // -- Writes --

    /**
     * Applies the node's pending intent, if any, and writes its row, all in one
     * transaction. Afterwards {@link TreeNode#hasMoved()} tells whether the
     * bounds changed.
     */
    public void save(TreeNode node) {
        if (!node.isPersisted() && !node.hasPendingIntent()) {
            node.makeRoot();
        }
        TreeNode before = node.copy();
        try {
            store.runInTransaction(() -> {
                actions.dispatch(session, node);
                if (node.isPersisted()) {
                    store.updateNode(node);
                    mutator.refresh(node);
                } else {
                    node.setId(store.insertNode(node));
                }
            });
        } catch (RuntimeException e) {
            restore(node, before);
            throw e;
        }
    }

    private static void restore(TreeNode node, TreeNode snapshot) {
        node.setId(snapshot.getId());
        node.applyBounds(snapshot.bounds());
        node.setDeletedAt(snapshot.getDeletedAt());
        node.setMoved(false);
    }

    /**
     * Explicit form of {@link #save}: loads the node, applies {@code intent}
     * and writes it back.
     *
     * @throws NodeNotFoundException if no node with that id exists
     */
    public MutationResult mutate(long nodeId, MutationIntent intent) {
        return store.inTransaction(() -> {
            TreeNode node = findOrFail(nodeId);
            actions.schedule(node, intent);
            save(node);
            return new MutationResult(nodeId, node.hasMoved(), node.bounds());
        });
    }

    public void saveAsRoot(TreeNode node) {
        save(node.makeRoot());
    }

    /** Saves {@code child} as the last child of {@code parent}. */
    public void append(TreeNode parent, TreeNode child) {
        save(child.appendTo(parent));
    }

    /** Saves {@code child} as the first child of {@code parent}. */
    public void prepend(TreeNode parent, TreeNode child) {
        save(child.prependTo(parent));
    }

    /**
     * Saves {@code node} directly before {@code target}. The target is
     * refreshed afterwards since it shifted.
     *
     * @return whether {@code node} moved
     */
    public boolean insertBefore(TreeNode node, TreeNode target) {
        save(node.before(target));
        if (node.hasMoved()) {
            mutator.refresh(target);
        }
        return node.hasMoved();
    }

    /** Saves {@code node} directly after {@code target}. */
    public boolean insertAfter(TreeNode node, TreeNode target) {
        save(node.after(target));
        if (node.hasMoved()) {
            mutator.refresh(target);
        }
        return node.hasMoved();
    }

    /**
     * Moves the node up among its siblings by {@code amount} positions.
     *
     * @return {@code false} if there are fewer than {@code amount} siblings
     *         before it
     */
    public boolean up(TreeNode node, int amount) {
        requirePositive(amount);
        List<TreeNode> previous = query.prevSiblings(node);
        if (previous.size() < amount) {
            return false;
        }
        return insertBefore(node, previous.get(amount - 1));
    }

    /** Moves the node down among its siblings by {@code amount} positions. */
    public boolean down(TreeNode node, int amount) {
        requirePositive(amount);
        List<TreeNode> next = query.nextSiblings(node);
        if (next.size() < amount) {
            return false;
        }
        return insertAfter(node, next.get(amount - 1));
    }

    private static void requirePositive(int amount) {
        if (amount < 1) {
            throw new IllegalArgumentException("Amount must be at least 1, got " + amount);
        }
    }

    /**
     * Reassigns the node's parent by id: appends it as the last child of the
     * new parent, or makes it a root for {@code null}. Nothing happens if the
     * parent is unchanged.
     *
     * @throws NodeNotFoundException if {@code parentId} names no node
     */
    public void moveToParent(TreeNode node, Long parentId) {
        if (node.isPersisted()) {
            mutator.refresh(node);
        }
        if (node.isPersisted() && Objects.equals(node.getParentId(), parentId)) {
            node.setMoved(false);
            return;
        }
        if (parentId == null) {
            node.makeRoot();
        } else {
            node.appendTo(findOrFail(parentId));
        }
        save(node);
    }

    /** Creates a new root with all nested children described by {@code spec}. */
    public NodeTree create(NodeSpec spec) {
        return create(spec, null);
    }

    /**
     * Creates the node described by {@code spec} as the last child of
     * {@code parent} (or as a new root when {@code parent} is {@code null}),
     * followed by its children in order, in one transaction.
     */
    public NodeTree create(NodeSpec spec, TreeNode parent) {
        return store.inTransaction(() -> {
            NodeTree created = createRecursive(spec, parent);
            refreshAll(created);
            return created;
        });
    }

    private NodeTree createRecursive(NodeSpec spec, TreeNode parent) {
        TreeNode node = new TreeNode(spec.name());
        if (parent != null) {
            node.appendTo(parent);
        }
        save(node);

        List<NodeTree> children = new ArrayList<>(spec.children().size());
        for (NodeSpec child : spec.children()) {
            children.add(createRecursive(child, node));
        }
        return new NodeTree(node, children);
    }

    private void refreshAll(NodeTree tree) {
        mutator.refresh(tree.node());
        for (NodeTree child : tree.children()) {
            refreshAll(child);
        }
    }

    /**
     * Deletes the node. A hard delete removes the node with its whole subtree,
     * closes the gap and detaches the instance (see
     * {@link TreeMutator#delete}); a soft delete only marks the row.
     *
     * @return number of rows removed, 0 for a soft delete
     */
    public int delete(TreeNode node) {
        if (!node.isPersisted()) {
            throw new IllegalStateException("Cannot delete a node that was never saved.");
        }
        if (session.isSoftDelete()) {
            long now = System.currentTimeMillis() / 1000;
            store.markDeleted(node.getId(), now);
            node.setDeletedAt(now);
            LOG.debug("[Tree] Soft-deleted node {}", node.getId());
            return 0;
        }
        return mutator.delete(session, node);
    }

    /** Clears the soft-delete marker of the node. */
    public void restore(TreeNode node) {
        if (!node.isPersisted()) {
            throw new IllegalStateException("Cannot restore a node that was never saved.");
        }
        store.markDeleted(node.getId(), null);
        node.setDeletedAt(null);
    }

    /** Re-reads the node's bounds and parent from storage. */
    public void refreshNode(TreeNode node) {
        mutator.refresh(node);
    }

    // -- Reads --

    public Optional<TreeNode> find(long id) {
        return query.find(id);
    }

    public TreeNode findOrFail(long id) {
        return query.find(id).orElseThrow(() -> new NodeNotFoundException(id));
    }

    /** Current bounds of a node, including soft-deleted ones. */
    public Optional<NodeBounds> bounds(long id) {
        return store.loadBounds(id);
    }

    public TreeQuery query() {
        return query;
    }

    TreeSession session() {
        return session;
    }
}
