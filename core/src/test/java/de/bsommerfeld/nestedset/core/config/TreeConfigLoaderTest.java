package de.bsommerfeld.nestedset.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TreeConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaults_shouldDisableSoftDeleteAndUseDefaultTable() {
        var config = new TreeConfig();

        assertFalse(config.isSoftDelete());
        assertNotNull(config.getStorage());
        assertEquals("tree_nodes", config.getStorage().getTable());
        assertEquals("nestedset.db", config.getStorage().getDatabaseFile());
    }

    @Test
    void load_shouldCreateMissingFileWithDefaults() {
        Path configPath = tempDir.resolve("nested/config.toml");

        TreeConfig config = TreeConfigLoader.load(configPath);

        assertTrue(Files.exists(configPath));
        assertFalse(config.isSoftDelete());
        assertEquals("tree_nodes", config.getStorage().getTable());
    }

    @Test
    void load_shouldReadValuesFromToml() throws IOException {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, String.join("\n",
                "soft-delete = true",
                "",
                "[storage]",
                "table = \"categories\"",
                "database-file = \"/tmp/categories.db\"",
                ""));

        TreeConfig config = TreeConfigLoader.load(configPath);

        assertTrue(config.isSoftDelete());
        assertEquals("categories", config.getStorage().getTable());
        assertEquals("/tmp/categories.db", config.getStorage().getDatabaseFile());
    }

    @Test
    void load_shouldIgnoreUnknownKeysAndKeepDefaultsForMissingOnes() throws IOException {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, "legacy-option = 42\nsoft-delete = true\n");

        TreeConfig config = TreeConfigLoader.load(configPath);

        assertTrue(config.isSoftDelete());
        assertEquals("tree_nodes", config.getStorage().getTable());
    }

    @Test
    void save_thenLoad_shouldPreserveChangedValues() throws IOException {
        Path configPath = tempDir.resolve("config.toml");
        var config = new TreeConfig();
        config.setSoftDelete(true);
        config.getStorage().setTable("menu_items");

        TreeConfigLoader.save(configPath, config);
        TreeConfig loaded = TreeConfigLoader.load(configPath);

        assertTrue(loaded.isSoftDelete());
        assertEquals("menu_items", loaded.getStorage().getTable());
    }

    @Test
    void load_shouldFailOnMalformedToml() throws IOException {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, "soft-delete = = true\n");

        assertThrows(java.io.UncheckedIOException.class, () -> TreeConfigLoader.load(configPath));
    }
}
