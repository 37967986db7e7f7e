package de.bsommerfeld.nestedset.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the tree store. {@code PROD} persists to SQLite,
 * {@code TEST} keeps the whole tree in memory.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    static final String PROPERTY = "nestedset.mode";
    static final String ENV = "NESTEDSET_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code nestedset.mode} system property, then
     * the {@code NESTEDSET_MODE} environment variable. Defaults to PROD if
     * neither is set or the value is unknown.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv(ENV);
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
