package de.bsommerfeld.nestedset.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MutationIntentTest {

    @Test
    void root_shouldHaveNoTarget() {
        MutationIntent intent = MutationIntent.root();

        assertEquals(MutationIntent.Action.ROOT, intent.action());
        assertNull(intent.target());
    }

    @Test
    void root_shouldDropAnyGivenTarget() {
        var intent = new MutationIntent(MutationIntent.Action.ROOT, new TreeNode("ignored"));
        assertNull(intent.target());
    }

    @Test
    void targetedActions_shouldRequireTarget() {
        assertThrows(NullPointerException.class, () -> MutationIntent.appendTo(null));
        assertThrows(NullPointerException.class, () -> MutationIntent.prependTo(null));
        assertThrows(NullPointerException.class, () -> MutationIntent.before(null));
        assertThrows(NullPointerException.class, () -> MutationIntent.after(null));
    }

    @Test
    void factories_shouldSetMatchingAction() {
        var target = new TreeNode("target");

        assertEquals(MutationIntent.Action.APPEND_TO, MutationIntent.appendTo(target).action());
        assertEquals(MutationIntent.Action.PREPEND_TO, MutationIntent.prependTo(target).action());
        assertEquals(MutationIntent.Action.BEFORE, MutationIntent.before(target).action());
        assertEquals(MutationIntent.Action.AFTER, MutationIntent.after(target).action());
        assertSame(target, MutationIntent.after(target).target());
    }
}
