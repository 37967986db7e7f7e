package de.bsommerfeld.nestedset.core.domain;

/**
 * Diagnostic counts produced by a consistency check. A healthy tree reports
 * zero everywhere. Nothing here is repaired automatically.
 *
 * @param oddness       nodes with {@code rgt <= lft} or an odd height
 * @param duplicates    pairs of nodes sharing a bound value
 * @param wrongParent   nodes whose stored parent is not the nearest node
 *                      enclosing them
 * @param missingParent nodes referencing a parent row that does not exist,
 *                      i.e. nodes cut off from every root
 */
public record TreeErrors(int oddness, int duplicates, int wrongParent, int missingParent) {

    public static final TreeErrors NONE = new TreeErrors(0, 0, 0, 0);

    public int total() {
        return oddness + duplicates + wrongParent + missingParent;
    }

    public boolean isBroken() {
        return total() > 0;
    }
}
