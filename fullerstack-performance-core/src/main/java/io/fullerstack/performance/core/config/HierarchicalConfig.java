package io.fullerstack.performance.core.config;

import java.time.Duration;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * Layered analyzer configuration backed by {@link ResourceBundle}.
 *
 * <p>Lookup order for every key:
 * <ol>
 *   <li>System property with the same key</li>
 *   <li>analyzer_{profile}.properties (profile override, when a profile is selected)</li>
 *   <li>analyzer.properties (shipped defaults)</li>
 * </ol>
 *
 * <p>Profiles ride on ResourceBundle's locale fallback: the profile name is used as the
 * locale language tag, so {@code forProfile("strict")} resolves
 * {@code analyzer_strict.properties} before falling back to {@code analyzer.properties}.
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * HierarchicalConfig config = HierarchicalConfig.global();
 * long interval = config.getLong("analysis.interval-ms");
 *
 * HierarchicalConfig strict = HierarchicalConfig.forProfile("strict");
 * double cpuPoor = strict.getDouble("thresholds.cpu-usage.poor");
 * </pre>
 *
 * <p>System properties win over both files:
 * <pre>
 * java -Danalysis.auto-optimization=true -jar app.jar
 * </pre>
 */
public class HierarchicalConfig {

    static final String BUNDLE_NAME = "analyzer";

    private final ResourceBundle bundle;
    private final String context;

    private HierarchicalConfig(ResourceBundle bundle, String context) {
        this.bundle = bundle;
        this.context = context;
    }

    /**
     * Shipped defaults (analyzer.properties).
     *
     * @return global configuration
     */
    public static HierarchicalConfig global() {
        ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
        return new HierarchicalConfig(bundle, "global");
    }

    /**
     * Profile-specific configuration falling back to the shipped defaults.
     *
     * @param profile profile name (e.g. "strict", "relaxed")
     * @return profile configuration
     */
    public static HierarchicalConfig forProfile(String profile) {
        Objects.requireNonNull(profile, "profile cannot be null");
        if (profile.isBlank()) {
            throw new IllegalArgumentException("profile cannot be blank");
        }

        Locale profileLocale = Locale.forLanguageTag(profile);
        ResourceBundle bundle = ResourceBundle.getBundle(
            BUNDLE_NAME,
            profileLocale,
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES)
        );
        return new HierarchicalConfig(bundle, "profile:" + profile);
    }

    // =========================================================================
    // Typed getters, system properties first
    // =========================================================================

    /**
     * @param key property key
     * @return property value
     * @throws ConfigurationException if key not found
     */
    public String getString(String key) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            throw new ConfigurationException(
                "Missing config key '" + key + "' in context: " + context, e
            );
        }
    }

    public String getString(String key, String defaultValue) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }
        return bundle.containsKey(key) ? bundle.getString(key) : defaultValue;
    }

    /**
     * @param key property key
     * @return property value as double
     * @throws ConfigurationException if key not found or invalid format
     */
    public double getDouble(String key) {
        String value = getString(key);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid double value for key '" + key + "': " + value, e
            );
        }
    }

    /**
     * @param key property key
     * @return property value as int
     * @throws ConfigurationException if key not found or invalid format
     */
    public int getInt(String key) {
        String value = getString(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "': " + value, e
            );
        }
    }

    /**
     * @param key property key
     * @return property value as long
     * @throws ConfigurationException if key not found or invalid format
     */
    public long getLong(String key) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid long value for key '" + key + "': " + value, e
            );
        }
    }

    /**
     * Reads a millisecond count as a {@link Duration}.
     *
     * @param key property key, by convention ending in {@code -ms}
     * @return duration value
     * @throws ConfigurationException if key not found, invalid or negative
     */
    public Duration getMillis(String key) {
        long millis = getLong(key);
        if (millis < 0) {
            throw new ConfigurationException("Negative duration for key '" + key + "': " + millis);
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Strict boolean: only {@code true} or {@code false} are accepted.
     *
     * @param key property key
     * @return property value as boolean
     * @throws ConfigurationException if key not found or not a boolean literal
     */
    public boolean getBoolean(String key) {
        String value = getString(key).trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigurationException("Invalid boolean value for key '" + key + "': " + value);
    }

    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return "HierarchicalConfig[context=" + context + "]";
    }
}
