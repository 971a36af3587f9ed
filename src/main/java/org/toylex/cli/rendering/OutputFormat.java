package org.toylex.cli.rendering;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.Locale;

/**
 * The output formats of the analyze command.
 */
public enum OutputFormat {
    /** Numbered symbol table followed by one {@code (code, index)} line per PIF entry. */
    TEXT,
    /** Pretty-printed JSON. */
    JSON;

    /** Path of the format setting in the application configuration. */
    public static final String CONFIG_PATH = "toylex.output.format";

    /**
     * Reads the configured format.
     * @param config The resolved application configuration.
     * @return The configured format, {@link #TEXT} if none is configured.
     * @throws ConfigException.BadValue if the configured value is not a known format.
     */
    public static OutputFormat fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return TEXT;
        }
        String value = config.getString(CONFIG_PATH);
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(CONFIG_PATH, "Unknown output format '" + value + "', expected TEXT or JSON");
        }
    }
}
