package com.cyclomatic;

import com.github.javaparser.ParserConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings from {@code /config.properties}; a JVM system property with the same key wins.
 */
public class ConfigurationManager {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationManager.class);
    private static final String CONFIG_FILE = "/config.properties";

    // Property keys as constants
    static final String KEY_OUTPUT_FILE = "report.output_file";
    static final String KEY_UNIT_NAME = "frontend.unit_name";
    static final String KEY_LANGUAGE_LEVEL = "frontend.language_level";
    static final String KEY_WRAP_BARE_MEMBERS = "frontend.wrap_bare_members";

    private static final String DEFAULT_OUTPUT_FILE = "output.cy";
    private static final String DEFAULT_UNIT_NAME = "unsaved.java";
    private static final ParserConfiguration.LanguageLevel DEFAULT_LANGUAGE_LEVEL = ParserConfiguration.LanguageLevel.JAVA_17;

    private final Properties properties;

    public ConfigurationManager() {
        this(loadClasspathProperties());
    }

    public ConfigurationManager(final Properties properties) {
        this.properties = properties;
    }

    private static Properties loadClasspathProperties() {
        final Properties loaded = new Properties();
        try (InputStream input = ConfigurationManager.class.getResourceAsStream(CONFIG_FILE)) {
            if (input == null) {
                log.warn("Unable to find {} on the classpath, using defaults.", CONFIG_FILE);
                return loaded;
            }
            loaded.load(input);
        } catch (final IOException e) {
            log.error("Error loading configuration file, using defaults", e);
        }
        return loaded;
    }

    private String get(final String key, final String defaultValue) {
        final String override = System.getProperty(key);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        final String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public Path getOutputFile() {
        return Paths.get(get(KEY_OUTPUT_FILE, DEFAULT_OUTPUT_FILE));
    }

    public String getUnitName() {
        return get(KEY_UNIT_NAME, DEFAULT_UNIT_NAME);
    }

    public ParserConfiguration.LanguageLevel getLanguageLevel() {
        final String level = get(KEY_LANGUAGE_LEVEL, DEFAULT_LANGUAGE_LEVEL.name());
        try {
            return ParserConfiguration.LanguageLevel.valueOf(level.toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            log.warn("Unknown language level '{}' for {}, falling back to {}", level, KEY_LANGUAGE_LEVEL, DEFAULT_LANGUAGE_LEVEL);
            return DEFAULT_LANGUAGE_LEVEL;
        }
    }

    public boolean isWrapBareMembers() {
        return Boolean.parseBoolean(get(KEY_WRAP_BARE_MEMBERS, "true"));
    }
}
