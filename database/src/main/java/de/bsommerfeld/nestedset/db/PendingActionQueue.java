package de.bsommerfeld.nestedset.db;

import de.bsommerfeld.nestedset.core.domain.MutationIntent;
import de.bsommerfeld.nestedset.core.domain.TreeNode;

import java.util.Optional;

/**
 * Holds the single deferred structural intent of each node instance and hands
 * it to {@link TreeMutator} right before the node's row is written.
 *
 * <p>
 * The buffer is the node instance itself: scheduling replaces whatever was
 * pending (last writer wins, no queuing). Dispatch consumes the intent
 * exactly once, clearing it before applying so a later save without a new
 * intent is a no-op rather than a repeated move.
 */
public class PendingActionQueue {

    private final TreeMutator mutator;

    public PendingActionQueue(TreeMutator mutator) {
        this.mutator = mutator;
    }

    public void schedule(TreeNode node, MutationIntent intent) {
        node.setPendingIntent(intent);
    }

    public Optional<MutationIntent> pending(TreeNode node) {
        return Optional.ofNullable(node.getPendingIntent());
    }

    /**
     * Applies and clears the node's pending intent. Must run inside the
     * transaction that writes the node's row.
     *
     * @return whether the node's bounds changed; also recorded on the node
     */
    public boolean dispatch(TreeSession session, TreeNode node) {
        node.setMoved(false);
        MutationIntent intent = node.getPendingIntent();
        if (intent == null) {
            return false;
        }
        node.setPendingIntent(null);

        boolean moved = mutator.apply(session, node, intent);
        node.setMoved(moved);
        return moved;
    }
}
