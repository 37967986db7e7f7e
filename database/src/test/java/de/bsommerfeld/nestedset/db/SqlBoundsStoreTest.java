package de.bsommerfeld.nestedset.db;

import de.bsommerfeld.nestedset.core.config.TreeConfig;
import de.bsommerfeld.nestedset.core.domain.NodeBounds;
import de.bsommerfeld.nestedset.core.domain.Ordering;
import de.bsommerfeld.nestedset.core.domain.TreeErrors;
import de.bsommerfeld.nestedset.core.domain.TreeNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against a real temporary SQLite database, plus the
 * SQL-specific parts: schema creation, table naming and raw corruption.
 */
class SqlBoundsStoreTest extends BoundsStoreContract {

    @TempDir
    Path tempDir;

    private String url() {
        return "jdbc:sqlite:" + tempDir.resolve("tree.db").toAbsolutePath();
    }

    @Override
    protected BoundsStore createStore() {
        return new SqlBoundsStore(url(), "tree_nodes");
    }

    private SqlBoundsStore sqlStore() {
        return (SqlBoundsStore) store;
    }

    // -- Schema --

    @Test
    void constructor_invalidTableName_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new SqlBoundsStore(url(), "nodes; DROP TABLE x"));
        assertThrows(IllegalArgumentException.class, () -> new SqlBoundsStore(url(), "1nodes"));
        assertThrows(IllegalArgumentException.class, () -> new SqlBoundsStore(url(), null));
    }

    @Test
    void constructor_existingFile_shouldKeepRows() {
        long a = insert("A", null, 1, 2);

        SqlBoundsStore reopened = new SqlBoundsStore(url(), "tree_nodes");

        assertEquals(new NodeBounds(1, 2, null), reopened.loadBounds(a).orElseThrow());
    }

    @Test
    void tables_inSameFile_shouldBeIndependent() {
        insert("A", null, 1, 2);
        SqlBoundsStore menu = new SqlBoundsStore(url(), "menu_items");

        assertEquals(0, menu.maxRight());
        assertTrue(menu.select(NodeFilter.all(), true, Ordering.DEFAULT).isEmpty());
        assertEquals(2, store.maxRight());
    }

    @Test
    void constructor_fromConfig_shouldUseConfiguredFileAndTable() {
        Path file = tempDir.resolve("nested").resolve("configured.db");
        TreeConfig config = new TreeConfig();
        config.getStorage().setDatabaseFile(file.toAbsolutePath().toString());
        config.getStorage().setTable("categories");

        SqlBoundsStore configured = new SqlBoundsStore(config);
        configured.insertNode(TreeNode.loaded(0, "A", null, 1, 2, null));

        assertTrue(Files.exists(file));
        assertEquals(2, configured.maxRight());
    }

    // -- Diagnostics on raw corruption --

    @Test
    void countErrors_afterRawCorruption_shouldReportEveryKind() throws SQLException {
        long a = insert("A", null, 1, 6);
        insert("B", a, 2, 5);
        insert("C", a, 3, 4);
        assertEquals(1, store.countErrors(true).wrongParent());

        try (Connection conn = sqlStore().getConnection(); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("UPDATE tree_nodes SET lft = 2 WHERE name = 'C'");
            stmt.executeUpdate("INSERT INTO tree_nodes (name, parent_id, lft, rgt) VALUES ('D', 404, 7, 8)");
        }

        TreeErrors errors = store.countErrors(true);
        assertEquals(1, errors.oddness());
        assertEquals(1, errors.duplicates());
        assertEquals(1, errors.missingParent());
        assertTrue(errors.isBroken());
    }
}
