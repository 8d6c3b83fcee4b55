package me.christianrobert.adqlpg.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Translator settings with defaults, changeable at runtime.
 */
@ApplicationScoped
public class AdqlConfigService {

    private static final Logger log = LoggerFactory.getLogger(AdqlConfigService.class);

    public static final String UFUNC_PREFIX = "adql.ufunc-prefix";
    public static final String UPLOAD_SCHEMA = "adql.upload-schema";
    public static final String USE_Q3C = "adql.use-q3c";
    public static final String ESCAPE_PERCENT = "adql.escape-percent";
    public static final String DEFAULT_LIMIT = "adql.default-limit";

    /** Prefix of the IVOA standard user defined functions, always accepted. */
    private static final String IVO_PREFIX = "ivo_";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public AdqlConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(UFUNC_PREFIX, "gavo_");
        configuration.put(UPLOAD_SCHEMA, "TAP_UPLOAD");
        configuration.put(USE_Q3C, true);
        configuration.put(ESCAPE_PERCENT, true);
        // adql.default-limit has no default: statements without TOP are not limited

        log.info("ADQL configuration initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer; numbers and numeric strings are accepted.
     *
     * @return the value, or null if unset or blank
     * @throws IllegalArgumentException if the value is not an integer
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String && !((String) value).trim().isEmpty()) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Configuration value " + key + " is not an integer: " + value, e);
            }
        }
        return null;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values: "gavo_,my_"
     * Trims whitespace and filters out empty strings.
     */
    public List<String> getConfigValueAsStringList(String key) {
        String value = getConfigValueAsString(key);
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }

        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    // ---- typed accessors for the translator settings

    /**
     * Name prefixes marking user defined functions; {@code ivo_} is always included.
     */
    public List<String> getUserFunctionPrefixes() {
        List<String> prefixes = getConfigValueAsStringList(UFUNC_PREFIX);
        if (!prefixes.contains(IVO_PREFIX)) {
            prefixes.add(IVO_PREFIX);
        }
        return prefixes;
    }

    public String getUploadSchema() {
        return getConfigValueAsString(UPLOAD_SCHEMA);
    }

    public boolean isUseQ3c() {
        return Boolean.TRUE.equals(getConfigValueAsBoolean(USE_Q3C));
    }

    public boolean isEscapePercent() {
        return Boolean.TRUE.equals(getConfigValueAsBoolean(ESCAPE_PERCENT));
    }

    public Integer getDefaultLimit() {
        return getConfigValueAsInteger(DEFAULT_LIMIT);
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public void removeConfigValue(String key) {
        Object oldValue = configuration.remove(key);
        log.debug("Config value removed: {} (was: {})", key, oldValue);
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
