package de.bsommerfeld.nestedset.db;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.nestedset.core.config.ApplicationMode;
import de.bsommerfeld.nestedset.core.config.TreeConfig;
import de.bsommerfeld.nestedset.core.domain.TreeNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class NestedSetModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void testMode_shouldBindInMemoryStore() {
        Injector injector = Guice.createInjector(
                new NestedSetModule(tempDir.resolve("config.toml"), ApplicationMode.TEST));

        BoundsStore store = injector.getInstance(BoundsStore.class);
        assertInstanceOf(InMemoryBoundsStore.class, store);
        assertSame(store, injector.getInstance(BoundsStore.class));
        assertTrue(Files.exists(tempDir.resolve("config.toml")));
    }

    @Test
    void testMode_repositoryShouldWork() {
        Injector injector = Guice.createInjector(
                new NestedSetModule(tempDir.resolve("config.toml"), ApplicationMode.TEST));

        NestedSetRepository repository = injector.getInstance(NestedSetRepository.class);
        TreeNode root = new TreeNode("root");
        repository.saveAsRoot(root);

        assertSame(repository, injector.getInstance(NestedSetRepository.class));
        assertEquals(1, root.getLft());
        assertEquals(2, root.getRgt());
    }

    @Test
    void prodMode_shouldBindSqliteStoreFromConfig() throws IOException {
        Path config = tempDir.resolve("config.toml");
        Path dbFile = tempDir.resolve("prod.db").toAbsolutePath();
        Files.writeString(config, String.join("\n",
                "soft-delete = true",
                "",
                "[storage]",
                "table = \"categories\"",
                "database-file = \"" + dbFile.toString().replace("\\", "\\\\") + "\"",
                ""));

        Injector injector = Guice.createInjector(new NestedSetModule(config, ApplicationMode.PROD));

        assertInstanceOf(SqlBoundsStore.class, injector.getInstance(BoundsStore.class));
        assertTrue(injector.getInstance(TreeConfig.class).isSoftDelete());
        assertEquals("categories", injector.getInstance(TreeConfig.class).getStorage().getTable());

        NestedSetRepository repository = injector.getInstance(NestedSetRepository.class);
        assertTrue(repository.session().isSoftDelete());
        repository.saveAsRoot(new TreeNode("root"));
        assertTrue(Files.exists(dbFile));
    }
}
