package de.bsommerfeld.nestedset.core.domain;

import java.util.Objects;

/**
 * A structural change waiting to be applied to a node at its next save.
 *
 * @param action what to do
 * @param target the reference node: the parent for {@code APPEND_TO} and
 *               {@code PREPEND_TO}, the sibling for {@code BEFORE} and
 *               {@code AFTER}, {@code null} for {@code ROOT}
 */
public record MutationIntent(Action action, TreeNode target) {

    public enum Action {
        /** Become the last root. */
        ROOT,
        /** Become the last child of the target. */
        APPEND_TO,
        /** Become the first child of the target. */
        PREPEND_TO,
        /** Become the sibling directly before the target. */
        BEFORE,
        /** Become the sibling directly after the target. */
        AFTER
    }

    public MutationIntent {
        Objects.requireNonNull(action, "action");
        if (action == Action.ROOT) {
            target = null;
        } else {
            Objects.requireNonNull(target, () -> action + " requires a target node");
        }
    }

    public static MutationIntent root() {
        return new MutationIntent(Action.ROOT, null);
    }

    public static MutationIntent appendTo(TreeNode parent) {
        return new MutationIntent(Action.APPEND_TO, parent);
    }

    public static MutationIntent prependTo(TreeNode parent) {
        return new MutationIntent(Action.PREPEND_TO, parent);
    }

    public static MutationIntent before(TreeNode sibling) {
        return new MutationIntent(Action.BEFORE, sibling);
    }

    public static MutationIntent after(TreeNode sibling) {
        return new MutationIntent(Action.AFTER, sibling);
    }
}
