package org.toylex.analyzer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Settings of the {@link LexicalAnalyzer}, read from the {@code toylex.analyzer} block.
 *
 * <pre>
 * toylex.analyzer {
 *   default-source-name = "&lt;memory&gt;"
 *   charset = "UTF-8"
 * }
 * </pre>
 *
 * @param defaultSourceName The logical name used for sources analyzed from memory.
 * @param charset The charset used to read source files.
 */
public record AnalyzerOptions(String defaultSourceName, Charset charset) {

    /** Path of the analyzer block in the application configuration. */
    public static final String CONFIG_PATH = "toylex.analyzer";

    private static final String DEFAULT_SOURCE_NAME_KEY = "default-source-name";
    private static final String CHARSET_KEY = "charset";

    /**
     * @return The options used when no configuration is given.
     */
    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions("<memory>", StandardCharsets.UTF_8);
    }

    /**
     * Reads the options from an application configuration. Missing keys keep their defaults.
     * @param config The resolved application configuration.
     * @return The analyzer options.
     * @throws ConfigException.BadValue if the charset is unknown.
     */
    public static AnalyzerOptions fromConfig(Config config) {
        AnalyzerOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config analyzerConfig = config.getConfig(CONFIG_PATH);
        String sourceName = analyzerConfig.hasPath(DEFAULT_SOURCE_NAME_KEY)
                ? analyzerConfig.getString(DEFAULT_SOURCE_NAME_KEY)
                : defaults.defaultSourceName();
        Charset charset = defaults.charset();
        if (analyzerConfig.hasPath(CHARSET_KEY)) {
            String charsetName = analyzerConfig.getString(CHARSET_KEY);
            try {
                charset = Charset.forName(charsetName);
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(
                        analyzerConfig.origin(), CONFIG_PATH + "." + CHARSET_KEY, "Unknown charset '" + charsetName + "'", e);
            }
        }
        return new AnalyzerOptions(sourceName, charset);
    }
}
