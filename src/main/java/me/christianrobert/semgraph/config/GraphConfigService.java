package me.christianrobert.semgraph.config;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.semgraph.context.BuildLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide default build limits.
 *
 * <p>Builds never read this service while running: callers take an immutable
 * {@link #currentLimits()} snapshot and pass it in at the build root.</p>
 */
@ApplicationScoped
public class GraphConfigService {

    private static final Logger log = LoggerFactory.getLogger(GraphConfigService.class);

    public static final String MAX_DEPTH = "build.max-depth";
    public static final String MAX_CAPTURES = "build.max-captures";
    public static final String MAX_FAN_OUT = "build.max-fan-out";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public GraphConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(MAX_DEPTH, BuildLimits.DEFAULT_MAX_DEPTH);
        configuration.put(MAX_CAPTURES, BuildLimits.DEFAULT_MAX_CAPTURES);
        configuration.put(MAX_FAN_OUT, BuildLimits.DEFAULT_MAX_FAN_OUT);

        log.info("Graph configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    /**
     * Gets a configuration value as an integer.
     * Accepts numbers and numeric strings (values may arrive as JSON strings).
     *
     * @param key Configuration key
     * @param fallback Value returned when the key is missing or not numeric
     */
    public int getConfigValueAsInt(String key, int fallback) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number, using {}", key, value, fallback);
                return fallback;
            }
        }
        return fallback;
    }

    /**
     * Immutable snapshot of the configured limits.
     *
     * @throws IllegalArgumentException if a configured limit is below 1
     */
    public BuildLimits currentLimits() {
        return new BuildLimits(
                getConfigValueAsInt(MAX_DEPTH, BuildLimits.DEFAULT_MAX_DEPTH),
                getConfigValueAsInt(MAX_CAPTURES, BuildLimits.DEFAULT_MAX_CAPTURES),
                getConfigValueAsInt(MAX_FAN_OUT, BuildLimits.DEFAULT_MAX_FAN_OUT));
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
