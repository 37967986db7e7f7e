package de.bsommerfeld.nestedset.db;

import com.google.inject.Singleton;
import de.bsommerfeld.nestedset.core.domain.NodeBounds;
import de.bsommerfeld.nestedset.core.domain.Ordering;
import de.bsommerfeld.nestedset.core.domain.TreeErrors;
import de.bsommerfeld.nestedset.core.domain.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * In-memory {@link BoundsStore} for TEST mode: no disk I/O, no SQLite, no
 * schema. Bound by Guice when the application runs with
 * {@code nestedset.mode=TEST}, and used by the simulation tests that replay
 * thousands of mutations.
 *
 * <p>
 * Rows are private copies; nothing handed out aliases the stored state.
 * {@link #inTransaction} snapshots every row before the outermost unit of work
 * and restores the snapshot if the work throws, which mirrors the rollback of
 * the SQL store.
 */
@Singleton
public class InMemoryBoundsStore implements BoundsStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryBoundsStore.class);

    private final Map<Long, TreeNode> rows = new TreeMap<>();
    private long nextId = 1;
    private int transactionDepth;

    public InMemoryBoundsStore() {
        LOG.warn("#####################################################");
        LOG.warn("#  TEST MODE ENABLED: tree persistence is DISABLED   #");
        LOG.warn("#####################################################");
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (transactionDepth > 0) {
            return work.get();
        }
        Map<Long, TreeNode> snapshot = copyRows();
        long idSnapshot = nextId;
        transactionDepth++;
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            rows.clear();
            rows.putAll(snapshot);
            nextId = idSnapshot;
            throw e;
        } finally {
            transactionDepth--;
        }
    }

    private Map<Long, TreeNode> copyRows() {
        Map<Long, TreeNode> copy = new TreeMap<>();
        rows.forEach((id, row) -> copy.put(id, row.copy()));
        return copy;
    }

    @Override
    public int maxRight() {
        int max = 0;
        for (TreeNode row : rows.values()) {
            max = Math.max(max, row.getRgt());
        }
        return max;
    }

    @Override
    public Optional<NodeBounds> loadBounds(long id) {
        TreeNode row = rows.get(id);
        return row == null ? Optional.empty() : Optional.of(row.bounds());
    }

    @Override
    public int shiftBounds(int cut, int delta) {
        int touched = 0;
        for (TreeNode row : rows.values()) {
            int lft = row.getLft();
            int rgt = row.getRgt();
            if (lft >= cut) {
                lft += delta;
                touched++;
            }
            if (rgt >= cut) {
                rgt += delta;
                touched++;
            }
            row.setBounds(lft, rgt);
        }
        return touched;
    }

    @Override
    public int moveSubtree(int lft, int rgt, int from, int to, int height, int distance) {
        int updated = 0;
        for (TreeNode row : rows.values()) {
            boolean inRange = between(row.getLft(), from, to) || between(row.getRgt(), from, to);
            if (!inRange) {
                continue;
            }
            row.setBounds(patch(row.getLft(), lft, rgt, from, to, height, distance),
                    patch(row.getRgt(), lft, rgt, from, to, height, distance));
            updated++;
        }
        return updated;
    }

    /** Same case split as {@code move-subtree.sql}. */
    private static int patch(int value, int lft, int rgt, int from, int to, int height, int distance) {
        if (between(value, lft, rgt)) {
            return value + distance;
        }
        if (between(value, from, to)) {
            return value + height;
        }
        return value;
    }

    private static boolean between(int value, int low, int high) {
        return value >= low && value <= high;
    }

    @Override
    public int deleteRange(int lft, int rgt) {
        int before = rows.size();
        rows.values().removeIf(row -> between(row.getLft(), lft, rgt));
        return before - rows.size();
    }

    @Override
    public long insertNode(TreeNode node) {
        long id = nextId++;
        TreeNode row = TreeNode.loaded(id, node.getName(), node.getParentId(),
                node.getLft(), node.getRgt(), node.getDeletedAt());
        rows.put(id, row);
        return id;
    }

    @Override
    public void updateNode(TreeNode node) {
        TreeNode row = rows.get(node.getId());
        if (row == null) {
            return;
        }
        row.setName(node.getName());
    }

    @Override
    public void updateParent(long id, Long parentId) {
        TreeNode row = rows.get(id);
        if (row != null) {
            row.applyBounds(new NodeBounds(row.getLft(), row.getRgt(), parentId));
        }
    }

    @Override
    public void markDeleted(long id, Long deletedAt) {
        TreeNode row = rows.get(id);
        if (row != null) {
            row.setDeletedAt(deletedAt);
        }
    }

    @Override
    public Optional<TreeNode> find(long id, boolean includeSoftDeleted) {
        TreeNode row = rows.get(id);
        if (row == null || (!includeSoftDeleted && row.isDeleted())) {
            return Optional.empty();
        }
        return Optional.of(detachedCopy(row));
    }

    @Override
    public List<TreeNode> select(NodeFilter filter, boolean includeSoftDeleted, Ordering ordering) {
        List<TreeNode> result = new ArrayList<>();
        for (TreeNode row : rows.values()) {
            if ((includeSoftDeleted || !row.isDeleted()) && filter.matches(row)) {
                result.add(detachedCopy(row));
            }
        }
        result.sort(ordering.comparator());
        return result;
    }

    private static TreeNode detachedCopy(TreeNode row) {
        return TreeNode.loaded(row.getId(), row.getName(), row.getParentId(),
                row.getLft(), row.getRgt(), row.getDeletedAt());
    }

    @Override
    public TreeErrors countErrors(boolean includeSoftDeleted) {
        List<TreeNode> scope = new ArrayList<>();
        for (TreeNode row : rows.values()) {
            if (includeSoftDeleted || !row.isDeleted()) {
                scope.add(row);
            }
        }

        int oddness = 0;
        int duplicates = 0;
        int wrongParent = 0;
        int missingParent = 0;

        for (int i = 0; i < scope.size(); i++) {
            TreeNode node = scope.get(i);
            if (node.getLft() >= node.getRgt() || (node.getRgt() - node.getLft()) % 2 == 0) {
                oddness++;
            }
            for (int j = i + 1; j < scope.size(); j++) {
                if (sharesBound(node, scope.get(j))) {
                    duplicates++;
                }
            }
            if (node.getParentId() != null && !rows.containsKey(node.getParentId())) {
                missingParent++;
            } else if (!Objects.equals(node.getParentId(), nearestEnclosing(node, scope))) {
                wrongParent++;
            }
        }
        return new TreeErrors(oddness, duplicates, wrongParent, missingParent);
    }

    private static boolean sharesBound(TreeNode a, TreeNode b) {
        return a.getLft() == b.getLft() || a.getRgt() == b.getRgt()
                || a.getLft() == b.getRgt() || a.getRgt() == b.getLft();
    }

    private static Long nearestEnclosing(TreeNode node, List<TreeNode> scope) {
        TreeNode nearest = null;
        for (TreeNode candidate : scope) {
            if (candidate.getLft() < node.getLft() && candidate.getRgt() > node.getRgt()
                    && (nearest == null || candidate.getLft() > nearest.getLft())) {
                nearest = candidate;
            }
        }
        return nearest == null ? null : nearest.getId();
    }

    /** Number of stored rows, soft-deleted ones included. */
    public int size() {
        return rows.size();
    }
}
