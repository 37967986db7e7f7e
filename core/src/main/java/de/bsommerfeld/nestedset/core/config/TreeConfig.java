package de.bsommerfeld.nestedset.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}.
 *
 * <pre>
 * soft-delete = false
 *
 * [storage]
 * table = "tree_nodes"
 * database-file = "nestedset.db"
 * </pre>
 */
public class TreeConfig {

    /**
     * When enabled, deleting a node only stamps {@code deleted_at}; the row
     * keeps its bounds and stays visible to maintenance scans.
     */
    @JsonProperty("soft-delete")
    private boolean softDelete = false;

    @JsonProperty("storage")
    private StorageConfig storage = new StorageConfig();

    public boolean isSoftDelete() {
        return softDelete;
    }

    public void setSoftDelete(boolean softDelete) {
        this.softDelete = softDelete;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage;
    }
}
