package com.skanga.mysqlmcp.config;

import java.util.Locale;

/**
 * How the startup check decides that the configured account cannot write.
 */
public enum VerificationStrategy {
    /** Inspect {@code SHOW GRANTS FOR CURRENT_USER()}. */
    GRANTS,
    /** Attempt a harmless write and expect it to be denied. */
    PROBE;

    /**
     * Parses a configuration value such as {@code grants} or {@code probe}.
     *
     * @throws IllegalArgumentException if the value names no strategy
     */
    public static VerificationStrategy fromConfigValue(String configValue) {
        if (configValue == null) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.readonly.check.invalid", "null"));
        }
        for (VerificationStrategy strategy : values()) {
            if (strategy.name().equals(configValue.trim().toUpperCase(Locale.ROOT))) {
                return strategy;
            }
        }
        throw new IllegalArgumentException(
                ResourceManager.getErrorMessage("config.readonly.check.invalid", configValue));
    }
}
