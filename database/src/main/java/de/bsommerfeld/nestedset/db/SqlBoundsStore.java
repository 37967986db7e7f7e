package de.bsommerfeld.nestedset.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.nestedset.core.config.TreeConfig;
import de.bsommerfeld.nestedset.core.domain.NodeBounds;
import de.bsommerfeld.nestedset.core.domain.Ordering;
import de.bsommerfeld.nestedset.core.domain.TreeErrors;
import de.bsommerfeld.nestedset.core.domain.TreeNode;
import de.bsommerfeld.nestedset.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * SQLite-backed {@link BoundsStore} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * Outside a transaction a new {@link Connection} is opened per operation and
 * closed immediately after. SQLite serializes writes at the file level, so
 * pooling provides no benefit.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #inTransaction} pins one connection with auto-commit disabled; every
 * statement issued while it is open runs on that connection. A failure rolls
 * the whole unit back. The bulk bound shifts and the node's own row write
 * therefore commit or vanish together.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlBoundsStore implements BoundsStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlBoundsStore.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String dbUrl;
    private final String table;

    private Connection txConnection;

    @Inject
    public SqlBoundsStore(TreeConfig config) {
        this(jdbcUrlFor(config), config.getStorage().getTable());
    }

    public SqlBoundsStore(String dbUrl, String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        this.dbUrl = dbUrl;
        this.table = table;
        initialize();
    }

    private static String jdbcUrlFor(TreeConfig config) {
        Path file = StorageUtils.resolveDataFile(StorageUtils.APP_NAME, config.getStorage().getDatabaseFile());
        Path dir = file.getParent();
        try {
            if (dir != null && !Files.exists(dir))
                Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TreeStorageException("Failed to create database directory " + dir, e);
        }
        return "jdbc:sqlite:" + file;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing tree store at {} (table {})", dbUrl, table);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new TreeStorageException("Database initialization failed", e);
        }
    }

    /**
     * Applies the DDL from {@code schema.sql}, split on semicolons and executed
     * statement by statement inside one transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql = SqlLoader.loadScript("schema.sql", table);
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (!sql.trim().isEmpty())
                    stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.info("Tree schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (txConnection != null)
            return work.get();

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            txConnection = conn;
            try {
                T result = work.get();
                conn.commit();
                return result;
            } catch (RuntimeException | Error e) {
                rollbackQuietly(conn, e);
                throw e;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw new TreeStorageException("Failed to commit tree transaction", e);
            } finally {
                txConnection = null;
            }
        } catch (SQLException e) {
            throw new TreeStorageException("Failed to open tree transaction", e);
        }
    }

    /** Rolls back, attaching a rollback failure to the original cause. */
    private void rollbackQuietly(Connection conn, Throwable cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    /**
     * Runs {@code work} on the transaction's connection when one is open,
     * otherwise on a short-lived connection of its own.
     */
    private <T> T withConnection(String operation, SqlWork<T> work) {
        try {
            if (txConnection != null)
                return work.apply(txConnection);
            try (Connection conn = getConnection()) {
                return work.apply(conn);
            }
        } catch (SQLException e) {
            throw new TreeStorageException("Failed to " + operation, e);
        }
    }

    private String sql(String name) {
        return SqlLoader.load(name, table);
    }

    // =====================================================================
    // Bound maintenance
    // =====================================================================

    @Override
    public int maxRight() {
        return withConnection("read max right bound", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("max-rgt"));
                    ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    @Override
    public Optional<NodeBounds> loadBounds(long id) {
        return withConnection("load bounds of node " + id, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("select-bounds"))) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next())
                        return Optional.empty();
                    return Optional.of(new NodeBounds(rs.getInt("lft"), rs.getInt("rgt"),
                            getNullableLong(rs, "parent_id")));
                }
            }
        });
    }

    @Override
    public int shiftBounds(int cut, int delta) {
        return withConnection("shift bounds from " + cut, conn -> {
            int touched = 0;
            for (String statement : new String[] { "shift-lft", "shift-rgt" }) {
                try (PreparedStatement ps = conn.prepareStatement(sql(statement))) {
                    ps.setInt(1, delta);
                    ps.setInt(2, cut);
                    touched += ps.executeUpdate();
                }
            }
            LOG.debug("[DB] Shifted bounds >= {} by {} ({} column updates)", cut, delta, touched);
            return touched;
        });
    }

    @Override
    public int moveSubtree(int lft, int rgt, int from, int to, int height, int distance) {
        return withConnection("move subtree [" + lft + ", " + rgt + "]", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("move-subtree"))) {
                int i = 1;
                for (int column = 0; column < 2; column++) {
                    ps.setInt(i++, lft);
                    ps.setInt(i++, rgt);
                    ps.setInt(i++, distance);
                    ps.setInt(i++, from);
                    ps.setInt(i++, to);
                    ps.setInt(i++, height);
                }
                ps.setInt(i++, from);
                ps.setInt(i++, to);
                ps.setInt(i++, from);
                ps.setInt(i, to);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public int deleteRange(int lft, int rgt) {
        return withConnection("delete range [" + lft + ", " + rgt + "]", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("delete-range"))) {
                ps.setInt(1, lft);
                ps.setInt(2, rgt);
                return ps.executeUpdate();
            }
        });
    }

    // =====================================================================
    // Row writes
    // =====================================================================

    @Override
    public long insertNode(TreeNode node) {
        return withConnection("insert node " + node.getName(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("insert-node"), Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, node.getName());
                setNullableLong(ps, 2, node.getParentId());
                ps.setInt(3, node.getLft());
                ps.setInt(4, node.getRgt());
                setNullableLong(ps, 5, node.getDeletedAt());
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next())
                        throw new SQLException("No id generated for node " + node.getName());
                    return keys.getLong(1);
                }
            }
        });
    }

    @Override
    public void updateNode(TreeNode node) {
        withConnection("update node " + node.getId(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("update-node"))) {
                ps.setString(1, node.getName());
                ps.setLong(2, node.getId());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void updateParent(long id, Long parentId) {
        withConnection("update parent of node " + id, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("update-parent"))) {
                setNullableLong(ps, 1, parentId);
                ps.setLong(2, id);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void markDeleted(long id, Long deletedAt) {
        withConnection("mark node " + id + " deleted", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("mark-deleted"))) {
                setNullableLong(ps, 1, deletedAt);
                ps.setLong(2, id);
                return ps.executeUpdate();
            }
        });
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Override
    public Optional<TreeNode> find(long id, boolean includeSoftDeleted) {
        return withConnection("find node " + id, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql("select-node"))) {
                ps.setInt(1, includeSoftDeleted ? 1 : 0);
                ps.setLong(2, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapNode(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<TreeNode> select(NodeFilter filter, boolean includeSoftDeleted, Ordering ordering) {
        String statement = sql(filter.kind().statement()) + " ORDER BY lft " + ordering.sqlDirection();
        return withConnection("select " + filter.kind(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(statement)) {
                ps.setInt(1, includeSoftDeleted ? 1 : 0);
                bindFilter(ps, filter);
                List<TreeNode> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        result.add(mapNode(rs));
                }
                return result;
            }
        });
    }

    /** Binds the filter's reference values after the soft-delete flag. */
    private void bindFilter(PreparedStatement ps, NodeFilter filter) throws SQLException {
        switch (filter.kind()) {
            case ALL:
                break;
            case DESCENDANTS:
            case ANCESTORS:
                ps.setInt(2, filter.lft());
                ps.setInt(3, filter.rgt());
                break;
            case AFTER:
                ps.setInt(2, filter.rgt());
                break;
            case BEFORE:
                ps.setInt(2, filter.lft());
                break;
            case CHILDREN:
                setNullableLong(ps, 2, filter.parentId());
                break;
            case SIBLINGS:
                setNullableLong(ps, 2, filter.parentId());
                ps.setLong(3, filter.excludeId());
                break;
            case NEXT_SIBLINGS:
                setNullableLong(ps, 2, filter.parentId());
                ps.setInt(3, filter.rgt());
                break;
            case PREV_SIBLINGS:
                setNullableLong(ps, 2, filter.parentId());
                ps.setInt(3, filter.lft());
                break;
            default:
                throw new IllegalStateException("Unhandled filter kind " + filter.kind());
        }
    }

    @Override
    public TreeErrors countErrors(boolean includeSoftDeleted) {
        return withConnection("count tree errors", conn -> new TreeErrors(
                count(conn, "count-oddness", includeSoftDeleted, 1),
                count(conn, "count-duplicates", includeSoftDeleted, 1),
                count(conn, "count-wrong-parent", includeSoftDeleted, 2),
                count(conn, "count-missing-parent", includeSoftDeleted, 1)));
    }

    /**
     * Runs a single-value count whose only parameters are {@code flags}
     * repetitions of the soft-delete flag.
     */
    private int count(Connection conn, String statement, boolean includeSoftDeleted, int flags)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql(statement))) {
            for (int i = 1; i <= flags; i++)
                ps.setInt(i, includeSoftDeleted ? 1 : 0);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    // =====================================================================
    // ResultSet mapping
    // =====================================================================

    private TreeNode mapNode(ResultSet rs) throws SQLException {
        return TreeNode.loaded(
                rs.getLong("id"), rs.getString("name"),
                getNullableLong(rs, "parent_id"),
                rs.getInt("lft"), rs.getInt("rgt"),
                getNullableLong(rs, "deleted_at"));
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null)
            ps.setNull(index, Types.INTEGER);
        else
            ps.setLong(index, value);
    }
}
