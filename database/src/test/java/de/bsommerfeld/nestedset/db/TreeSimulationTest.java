package de.bsommerfeld.nestedset.db;

import de.bsommerfeld.nestedset.core.domain.MutationIntent;
import de.bsommerfeld.nestedset.core.domain.MutationIntent.Action;
import de.bsommerfeld.nestedset.core.domain.NodeSpec;
import de.bsommerfeld.nestedset.core.domain.NodeTree;
import de.bsommerfeld.nestedset.core.domain.Ordering;
import de.bsommerfeld.nestedset.core.domain.TreeNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replays many mutations and checks the invariants after every step.
 */
class TreeSimulationTest {

    private static final Action[] ACTIONS = Action.values();

    @TempDir
    Path tempDir;

    // -- Exhaustive moves on a small tree --

    /**
     * <pre>
     * A
     * ├── B
     * │   ├── C
     * │   └── D
     * └── E
     * F
     * </pre>
     */
    private static ReferenceTree referenceFixture() {
        ReferenceTree tree = new ReferenceTree();
        tree.addRoot("A");
        tree.addChild("A", "B");
        tree.addChild("B", "C");
        tree.addChild("B", "D");
        tree.addChild("A", "E");
        tree.addRoot("F");
        return tree;
    }

    private static Map<String, Long> createFixture(NestedSetRepository repository) {
        Map<String, Long> ids = new HashMap<>();
        NodeTree a = repository.create(NodeSpec.of("A",
                NodeSpec.of("B", NodeSpec.leaf("C"), NodeSpec.leaf("D")),
                NodeSpec.leaf("E")));
        collectIds(a, ids);
        TreeNode f = new TreeNode("F");
        repository.saveAsRoot(f);
        ids.put("F", f.getId());
        return ids;
    }

    private static void collectIds(NodeTree tree, Map<String, Long> ids) {
        ids.put(tree.node().getName(), tree.node().getId());
        for (NodeTree child : tree.children()) {
            collectIds(child, ids);
        }
    }

    @Test
    void everyMove_onSmallTree_shouldMatchReferenceModel() {
        List<String> names = referenceFixture().names();
        for (String name : names) {
            for (String target : names) {
                for (Action action : ACTIONS) {
                    InMemoryBoundsStore store = new InMemoryBoundsStore();
                    NestedSetRepository repository = new NestedSetRepository(store, false);
                    Map<String, Long> ids = createFixture(repository);

                    ReferenceTree expected = referenceFixture();
                    List<String> original = expected.layout();
                    boolean allowed = expected.move(name, action, target);
                    assertEquals(original, TreeInvariants.layout(store), "fixture layout");

                    TreeNode node = repository.findOrFail(ids.get(name));
                    TreeNode other = repository.findOrFail(ids.get(target));
                    MutationIntent intent = action == Action.ROOT
                            ? MutationIntent.root()
                            : new MutationIntent(action, other);
                    boolean moved = repository.mutate(node.getId(), intent).moved();

                    String label = name + " " + action + " " + target;
                    assertEquals(expected.layout(), TreeInvariants.layout(store), label);
                    assertEquals(allowed && !original.equals(expected.layout()), moved, label);
                    TreeInvariants.assertValid(store);
                }
            }
        }
    }

    // -- Random sequences --

    @Test
    void randomOperations_shouldPreserveInvariants() {
        for (long seed = 1; seed <= 25; seed++) {
            InMemoryBoundsStore store = new InMemoryBoundsStore();
            NestedSetRepository repository = new NestedSetRepository(store, false);
            replay(new Random(seed), repository, store, 250, true);
        }
    }

    @Test
    void randomOperations_onSqlite_shouldMatchInMemory() {
        InMemoryBoundsStore memory = new InMemoryBoundsStore();
        SqlBoundsStore sqlite = new SqlBoundsStore(
                "jdbc:sqlite:" + tempDir.resolve("parity.db").toAbsolutePath(), "tree_nodes");

        replay(new Random(42), new NestedSetRepository(memory, false), memory, 120, false);
        replay(new Random(42), new NestedSetRepository(sqlite, false), sqlite, 120, false);

        assertEquals(TreeInvariants.layout(memory), TreeInvariants.layout(sqlite));
        TreeInvariants.assertValid(sqlite);
    }

    private static void replay(Random random, NestedSetRepository repository, BoundsStore store,
            int steps, boolean checkEveryStep) {
        int counter = 0;
        for (int step = 0; step < steps; step++) {
            List<TreeNode> nodes = store.select(NodeFilter.all(), true, Ordering.DEFAULT);
            int roll = random.nextInt(10);

            if (nodes.isEmpty() || roll < 4) {
                TreeNode created = new TreeNode("n" + counter++);
                if (!nodes.isEmpty()) {
                    TreeNode target = nodes.get(random.nextInt(nodes.size()));
                    created.setPendingIntent(intentFor(random, target));
                }
                repository.save(created);
            } else if (roll < 8) {
                TreeNode node = nodes.get(random.nextInt(nodes.size()));
                TreeNode target = nodes.get(random.nextInt(nodes.size()));
                List<String> before = TreeInvariants.layout(store);
                boolean moved = repository.mutate(node.getId(), intentFor(random, target)).moved();
                if (!moved) {
                    assertEquals(before, TreeInvariants.layout(store), "rejected move changed the tree");
                }
            } else if (roll < 9) {
                TreeNode node = nodes.get(random.nextInt(nodes.size()));
                int expected = node.getDescendantCount() + 1;
                assertEquals(expected, repository.delete(node));
            } else {
                TreeNode node = nodes.get(random.nextInt(nodes.size()));
                if (random.nextBoolean()) {
                    repository.up(node, 1 + random.nextInt(2));
                } else {
                    repository.down(node, 1 + random.nextInt(2));
                }
            }

            if (checkEveryStep) {
                TreeInvariants.assertValid(store);
            }
        }
    }

    private static MutationIntent intentFor(Random random, TreeNode target) {
        Action action = ACTIONS[random.nextInt(ACTIONS.length)];
        return action == Action.ROOT ? MutationIntent.root() : new MutationIntent(action, target);
    }
}
