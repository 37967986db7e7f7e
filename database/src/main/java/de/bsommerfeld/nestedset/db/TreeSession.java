package de.bsommerfeld.nestedset.db;

/**
 * Mutable context of one tree for the duration of its mutations. Each
 * repository owns its own session, so separate trees never share state.
 * Not thread-safe: a session follows the single control-flow path of the
 * mutation in progress.
 */
public class TreeSession {

    private final boolean softDelete;
    private boolean deleting;

    public TreeSession(boolean softDelete) {
        this.softDelete = softDelete;
    }

    /** Whether deletes only mark rows instead of removing them. Fixed at startup. */
    public boolean isSoftDelete() {
        return softDelete;
    }

    /**
     * Whether a subtree sweep is running. Deletes requested for rows inside
     * the sweep are plain row removals and must not close gaps themselves.
     */
    public boolean isDeleting() {
        return deleting;
    }

    void beginDeleting() {
        if (deleting) {
            throw new IllegalStateException("A subtree delete is already in progress");
        }
        deleting = true;
    }

    void endDeleting() {
        deleting = false;
    }
}
