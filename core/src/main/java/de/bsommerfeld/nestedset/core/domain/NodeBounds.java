package de.bsommerfeld.nestedset.core.domain;

/**
 * Snapshot of a node's position as stored: its interval and parent. Read
 * fresh from storage whenever a node serves as the reference point of a
 * mutation or query.
 *
 * @param lft      left bound, strictly less than {@code rgt}
 * @param rgt      right bound
 * @param parentId id of the parent row, {@code null} for roots
 */
public record NodeBounds(int lft, int rgt, Long parentId) {

    /** {@code rgt - lft + 1}; always even, 2 for a leaf. */
    public int height() {
        return rgt - lft + 1;
    }

    public int descendantCount() {
        return height() / 2 - 1;
    }

    public boolean isLeaf() {
        return height() == 2;
    }

    /** Whether {@code value} lies strictly inside this interval. */
    public boolean encloses(int value) {
        return value > lft && value < rgt;
    }
}
