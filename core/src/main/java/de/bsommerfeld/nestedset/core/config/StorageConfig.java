package de.bsommerfeld.nestedset.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where the tree lives: the SQLite file and the table holding the nodes.
 */
public class StorageConfig {

    @JsonProperty("table")
    private String table = "tree_nodes";

    /** Relative paths resolve against the application data directory. */
    @JsonProperty("database-file")
    private String databaseFile = "nestedset.db";

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }
}
