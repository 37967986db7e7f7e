package de.bsommerfeld.nestedset.db;

import de.bsommerfeld.nestedset.core.domain.NodeBounds;
import de.bsommerfeld.nestedset.core.domain.Ordering;
import de.bsommerfeld.nestedset.core.domain.TreeErrors;
import de.bsommerfeld.nestedset.core.domain.TreeNode;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Storage contract for the tree table. Implementations execute statements and
 * nothing else: every decision about which bounds to shift lives in
 * {@link GapAllocator} and {@link TreeMutator}.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlBoundsStore}: SQLite persistence for production</li>
 * <li>{@link InMemoryBoundsStore}: in-memory rows for TEST mode</li>
 * </ul>
 *
 * <p>
 * Reads used by tree maintenance ({@link #maxRight}, {@link #loadBounds}) and
 * all bulk writes always see soft-deleted rows, since those rows still occupy
 * bounds. Regular reads take an explicit {@code includeSoftDeleted} flag.
 *
 * <p>
 * Implementations are not thread-safe. One mutation runs at a time; isolation
 * between concurrent writers is left to the database.
 */
public interface BoundsStore {

    /**
     * Runs {@code work} inside one transaction. A call made while a
     * transaction is already open joins it. If {@code work} throws, every
     * statement issued since the outermost call is rolled back and the
     * exception propagates unchanged.
     */
    <T> T inTransaction(Supplier<T> work);

    default void runInTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    /** Largest right bound in the table, 0 for an empty tree. */
    int maxRight();

    /** Current bounds of a row, read fresh. */
    Optional<NodeBounds> loadBounds(long id);

    /**
     * Adds {@code delta} to every {@code lft} and, independently, every
     * {@code rgt} that is {@code >= cut}.
     *
     * @return number of rows touched by either update
     */
    int shiftBounds(int cut, int delta);

    /**
     * Moves the subtree {@code [lft, rgt]} by {@code distance} and every other
     * bound inside {@code [from, to]} by {@code height}, as one statement.
     *
     * @return number of rows updated
     */
    int moveSubtree(int lft, int rgt, int from, int to, int height, int distance);

    /**
     * Deletes every row whose left bound lies in {@code [lft, rgt]}.
     *
     * @return number of rows deleted
     */
    int deleteRange(int lft, int rgt);

    /**
     * Inserts a new row with the node's name, parent and bounds.
     *
     * @return the generated id
     */
    long insertNode(TreeNode node);

    /**
     * Writes the node's payload (its name). Parent and bounds of existing rows
     * are structural and only change through {@link #updateParent} and the
     * bulk statements, so a stale instance cannot overwrite them.
     */
    void updateNode(TreeNode node);

    /** Stores the parent a committed move assigned to the row. */
    void updateParent(long id, Long parentId);

    /** Sets or, with {@code null}, clears the soft-delete marker. */
    void markDeleted(long id, Long deletedAt);

    Optional<TreeNode> find(long id, boolean includeSoftDeleted);

    List<TreeNode> select(NodeFilter filter, boolean includeSoftDeleted, Ordering ordering);

    TreeErrors countErrors(boolean includeSoftDeleted);
}
