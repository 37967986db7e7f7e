package de.bsommerfeld.nestedset.core.domain;

import java.util.Comparator;

/**
 * Result order of tree queries. {@code DEFAULT} is document (pre-order)
 * order, ascending by left bound.
 */
public enum Ordering {

    DEFAULT("ASC"),
    REVERSED("DESC");

    private final String sqlDirection;

    Ordering(String sqlDirection) {
        this.sqlDirection = sqlDirection;
    }

    public String sqlDirection() {
        return sqlDirection;
    }

    public Comparator<TreeNode> comparator() {
        Comparator<TreeNode> byLeft = Comparator.comparingInt(TreeNode::getLft);
        return this == DEFAULT ? byLeft : byLeft.reversed();
    }

    public Ordering reverse() {
        return this == DEFAULT ? REVERSED : DEFAULT;
    }
}
