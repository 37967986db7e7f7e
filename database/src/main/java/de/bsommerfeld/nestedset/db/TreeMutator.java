package de.bsommerfeld.nestedset.db;

import de.bsommerfeld.nestedset.core.domain.MutationIntent;
import de.bsommerfeld.nestedset.core.domain.NodeBounds;
import de.bsommerfeld.nestedset.core.domain.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies structural intents to the tree by shifting bounds.
 *
 * <h3>Positions</h3>
 * Every intent reduces to "place the node so its left bound lands on
 * {@code position}":
 * <ul>
 * <li>{@code ROOT}: {@code max(rgt) + 1}</li>
 * <li>{@code PREPEND_TO p}: {@code p.lft + 1}</li>
 * <li>{@code APPEND_TO p}: {@code p.rgt}</li>
 * <li>{@code BEFORE n}: {@code n.lft}</li>
 * <li>{@code AFTER n}: {@code n.rgt + 1}</li>
 * </ul>
 * Reference nodes are re-read from storage first; an earlier mutation may have
 * shifted them since the caller loaded them.
 *
 * <h3>New nodes vs. moves</h3>
 * A node without an id gets a two-slot gap opened at the position. An existing
 * node moves with its whole subtree in a single bulk update, see
 * {@link #moveNode}.
 *
 * <p>
 * Each call runs in one store transaction, joining the caller's when one is
 * open. This is the only place a stored parent changes: it is written when a
 * move goes through, and a rejected move leaves row and node as they were.
 */
public class TreeMutator {

    private static final Logger LOG = LoggerFactory.getLogger(TreeMutator.class);

    private final BoundsStore store;
    private final GapAllocator gaps;

    public TreeMutator(BoundsStore store, GapAllocator gaps) {
        this.store = store;
        this.gaps = gaps;
    }

    /**
     * Applies {@code intent} to {@code node}.
     *
     * @return whether the node's bounds changed
     * @throws IllegalStateException if the intent references a node that has
     *                               not been saved, or a subtree delete is in
     *                               progress
     */
    public boolean apply(TreeSession session, TreeNode node, MutationIntent intent) {
        if (session.isDeleting()) {
            throw new IllegalStateException("Cannot restructure the tree while a subtree delete is in progress");
        }
        return store.inTransaction(() -> {
            switch (intent.action()) {
                case ROOT:
                    return makeRoot(node);
                case APPEND_TO:
                    return appendOrPrepend(node, intent.target(), false);
                case PREPEND_TO:
                    return appendOrPrepend(node, intent.target(), true);
                case BEFORE:
                    return beforeOrAfter(node, intent.target(), false);
                case AFTER:
                    return beforeOrAfter(node, intent.target(), true);
                default:
                    throw new IllegalStateException("Unhandled action " + intent.action());
            }
        });
    }

    private boolean makeRoot(TreeNode node) {
        if (!node.isPersisted()) {
            // Past every existing bound, nothing to shift.
            int cut = store.maxRight() + 1;
            node.applyBounds(new NodeBounds(cut, cut + 1, null));
            LOG.debug("[Tree] New root {} at [{}, {}]", node.getName(), cut, cut + 1);
            return true;
        }

        refresh(node);
        if (node.isRoot()) {
            return false;
        }
        return insertAt(node, store.maxRight() + 1, null);
    }

    private boolean appendOrPrepend(TreeNode node, TreeNode parent, boolean prepend) {
        requirePersisted(parent, "Cannot use non-existing node as a parent.");

        refresh(parent);
        int position = prepend ? parent.getLft() + 1 : parent.getRgt();

        if (insertAt(node, position, parent.getId())) {
            refresh(parent);
            return true;
        }
        return false;
    }

    private boolean beforeOrAfter(TreeNode node, TreeNode sibling, boolean after) {
        requirePersisted(sibling, "Cannot insert before/after non-existing node.");

        refresh(sibling);
        int position = after ? sibling.getRgt() + 1 : sibling.getLft();

        return insertAt(node, position, sibling.getParentId());
    }

    /**
     * Places the node at {@code position} under {@code parentId}. For a stored
     * node the new parent is written together with the move; a node that was
     * never saved gets it with its insert.
     */
    private boolean insertAt(TreeNode node, int position, Long parentId) {
        boolean persisted = node.isPersisted();
        boolean moved = persisted ? moveNode(node, position) : insertNode(node, position);
        if (moved) {
            if (persisted) {
                store.updateParent(node.getId(), parentId);
            }
            node.applyBounds(new NodeBounds(node.getLft(), node.getRgt(), parentId));
        }
        return moved;
    }

    /**
     * Opens a gap at {@code position} and places the node there. A node that
     * was never saved has no descendants, so its height is 2.
     */
    private boolean insertNode(TreeNode node, int position) {
        gaps.makeGap(position, 2);

        int height = node.getHeight();
        node.setBounds(position, position + height - 1);
        LOG.debug("[Tree] Inserted {} at [{}, {}]", node.getName(), position, position + height - 1);
        return true;
    }

    /**
     * Moves the node's subtree so that its left bound ends up where
     * {@code position} currently is.
     *
     * <p>
     * Only bounds inside {@code [from, to]}, the span covering the old
     * subtree and the target, change. Within it, the subtree's own bounds
     * travel by {@code distance} and every other bound shifts by the subtree
     * height in the opposite direction to fill the vacated slots:
     *
     * <pre>
     * moving right (position &gt; rgt):  from = lft,      to = position - 1
     *                                 subtree += to - rgt, others -= height
     * moving left  (position &lt; lft):  from = position, to = rgt
     *                                 subtree -= lft - from, others += height
     * </pre>
     *
     * A zero distance means the node already sits at the position
     * ({@code position == lft} or {@code position == rgt + 1}).
     */
    private boolean moveNode(TreeNode node, int position) {
        NodeBounds current = store.loadBounds(node.getId())
                .orElseThrow(() -> new NodeNotFoundException(node.getId()));
        int lft = current.lft();
        int rgt = current.rgt();

        if (lft < position && position <= rgt) {
            LOG.warn("[Tree] Rejected move of node {} into its own subtree", node.getId());
            node.applyBounds(current);
            return false;
        }

        int from = Math.min(lft, position);
        int to = Math.max(rgt, position - 1);
        int height = rgt - lft + 1;
        int distance = to - from + 1 - height;

        if (distance == 0) {
            node.applyBounds(current);
            return false;
        }

        if (position > lft) {
            height = -height;
        } else {
            distance = -distance;
        }

        int updated = store.moveSubtree(lft, rgt, from, to, height, distance);
        if (updated > 0) {
            refresh(node);
            LOG.debug("[Tree] Moved node {} from [{}, {}] to [{}, {}]",
                    node.getId(), lft, rgt, node.getLft(), node.getRgt());
            return true;
        }
        return false;
    }

    /**
     * Removes the node and its whole subtree, then closes the gap they leave.
     * While the sweep runs the session's delete guard is raised; a delete
     * requested for a row inside the sweep only returns 0, since the sweep
     * removes that row anyway.
     *
     * <p>
     * On return the node is detached: it has no id and a pending {@code ROOT}
     * intent, so saving it again re-creates it as a new root.
     *
     * @return number of rows removed
     */
    public int delete(TreeSession session, TreeNode node) {
        if (session.isDeleting()) {
            return 0;
        }
        requirePersisted(node, "Cannot delete a node that was never saved.");

        return store.inTransaction(() -> {
            refresh(node);
            int lft = node.getLft();
            int rgt = node.getRgt();
            int height = rgt - lft + 1;

            int removed;
            session.beginDeleting();
            try {
                removed = store.deleteRange(lft, rgt);
            } finally {
                session.endDeleting();
            }

            gaps.makeGap(rgt + 1, -height);
            LOG.debug("[Tree] Deleted subtree [{}, {}] of node {} ({} rows)", lft, rgt, node.getId(), removed);

            node.detach();
            return removed;
        });
    }

    /**
     * Re-reads the node's bounds and parent from storage. Nodes that were
     * never saved are left untouched.
     */
    public void refresh(TreeNode node) {
        if (!node.isPersisted()) {
            return;
        }
        NodeBounds bounds = store.loadBounds(node.getId())
                .orElseThrow(() -> new NodeNotFoundException(node.getId()));
        node.applyBounds(bounds);
    }

    private static void requirePersisted(TreeNode node, String message) {
        Objects.requireNonNull(node, "node");
        if (!node.isPersisted()) {
            throw new IllegalStateException(message);
        }
    }
}
