package de.bsommerfeld.nestedset.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Statements refer to the tree table as {@code {table}} so one set of files
 * serves every configured table name; {@link #load(String, String)} fills it
 * in. Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<subject>.sql}, e.g.
 * {@code shift-lft.sql}, {@code select-descendants.sql}.
 *
 * @see SqlBoundsStore
 */
public final class SqlLoader {

    static final String TABLE_PLACEHOLDER = "{table}";

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the raw SQL from {@code sql/<name>.sql}, trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, n -> readResource("sql/" + n + ".sql"));
    }

    /**
     * Returns the statement from {@code sql/<name>.sql} with the table
     * placeholder replaced by {@code table}.
     */
    public static String load(String name, String table) {
        return load(name).replace(TABLE_PLACEHOLDER, table);
    }

    /**
     * Returns a top-level classpath script, e.g. {@code schema.sql}, with the
     * table placeholder replaced. Scripts are not cached.
     */
    public static String loadScript(String path, String table) {
        return readResource(path).replace(TABLE_PLACEHOLDER, table);
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
