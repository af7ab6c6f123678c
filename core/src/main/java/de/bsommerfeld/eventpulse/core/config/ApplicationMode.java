package de.bsommerfeld.eventpulse.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Running mode of the worker. Controls whether real storage and the real
 * Reddit API are used.
 *
 * <ul>
 * <li>{@link #PROD}: configured storage backend and the Reddit OAuth API;
 * credentials are mandatory</li>
 * <li>{@link #TEST}: in-memory storage pre-seeded with demo events and an
 * offline Reddit stub; no credentials, no network</li>
 * </ul>
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code APP_MODE} variable of the given
     * lookup. Defaults to PROD if unset or unknown.
     */
    public static ApplicationMode resolve(Function<String, String> lookup) {
        String mode = lookup.apply("APP_MODE");
        if (mode == null || mode.isBlank()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown Application Mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
