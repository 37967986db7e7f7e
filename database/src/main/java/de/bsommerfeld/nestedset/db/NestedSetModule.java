package de.bsommerfeld.nestedset.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.nestedset.core.config.ApplicationMode;
import de.bsommerfeld.nestedset.core.config.TreeConfig;
import de.bsommerfeld.nestedset.core.config.TreeConfigLoader;
import de.bsommerfeld.nestedset.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice wiring for the tree store. Loads {@code config.toml}, binds
 * {@link TreeConfig}, and picks the {@link BoundsStore} implementation by
 * {@link ApplicationMode}: SQLite in PROD, in-memory in TEST.
 * {@link NestedSetRepository} binds to itself just in time.
 */
public class NestedSetModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(NestedSetModule.class);

    private final Path configPath;
    private final ApplicationMode mode;

    public NestedSetModule() {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("config.toml"), ApplicationMode.get());
    }

    public NestedSetModule(Path configPath, ApplicationMode mode) {
        this.configPath = configPath;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        TreeConfig config = TreeConfigLoader.load(configPath);
        bind(TreeConfig.class).toInstance(config);

        LOG.info("Application mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(BoundsStore.class).to(InMemoryBoundsStore.class);
        } else {
            bind(BoundsStore.class).to(SqlBoundsStore.class);
        }
    }
}
