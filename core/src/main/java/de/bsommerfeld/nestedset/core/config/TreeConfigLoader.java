package de.bsommerfeld.nestedset.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link TreeConfig} from a TOML file. A missing file is created with
 * the defaults so the user has something to edit. Unknown keys are ignored.
 */
public final class TreeConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TreeConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private TreeConfigLoader() {
    }

    /**
     * @param configPath location of {@code config.toml}
     * @return the parsed configuration, never {@code null}
     * @throws UncheckedIOException if the file exists but cannot be read or
     *                              the defaults cannot be written
     */
    public static TreeConfig load(Path configPath) {
        try {
            if (!Files.exists(configPath)) {
                TreeConfig defaults = new TreeConfig();
                save(configPath, defaults);
                LOG.info("Created default configuration at {}", configPath.toAbsolutePath());
                return defaults;
            }
            LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
            TreeConfig config = MAPPER.readValue(configPath.toFile(), TreeConfig.class);
            if (config.getStorage() == null) {
                config.setStorage(new StorageConfig());
            }
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + configPath, e);
        }
    }

    public static void save(Path configPath, TreeConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(configPath.toFile(), config);
    }
}
