package de.bsommerfeld.nestedset.db;

import de.bsommerfeld.nestedset.core.domain.TreeNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBoundsStoreTest extends BoundsStoreContract {

    @Override
    protected BoundsStore createStore() {
        return new InMemoryBoundsStore();
    }

    @Test
    void find_shouldReturnCopiesThatDoNotAliasRows() {
        long a = insert("A", null, 1, 2);

        TreeNode copy = store.find(a, false).orElseThrow();
        copy.setBounds(7, 8);
        copy.setName("changed");

        TreeNode again = store.find(a, false).orElseThrow();
        assertEquals(1, again.getLft());
        assertEquals("A", again.getName());
    }

    @Test
    void size_shouldCountSoftDeletedRows() {
        long a = insert("A", null, 1, 2);
        insert("B", null, 3, 4);
        store.markDeleted(a, 1L);

        assertEquals(2, ((InMemoryBoundsStore) store).size());
    }
}
