package com.raditha.livediff.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads comparison settings from {@code livediff.yml} with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > livediff.yml > defaults
 */
public class LiveDiffSettings {

    private static final Logger logger = LoggerFactory.getLogger(LiveDiffSettings.class);

    public static final String DEFAULT_CONFIG_FILE = "livediff.yml";
    public static final String CONFIG_KEY = "live_dump_diff";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private static Map<String, Object> props = new HashMap<>();

    private LiveDiffSettings() {
    }

    /**
     * Load {@code livediff.yml} from the working directory. A missing file leaves the
     * configuration empty.
     */
    public static void loadConfigMap() throws IOException {
        File defaultFile = new File(DEFAULT_CONFIG_FILE);
        if (defaultFile.isFile()) {
            loadConfigMap(defaultFile);
        } else {
            props = new HashMap<>();
        }
    }

    /**
     * Load configuration from a YAML file.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws IOException              if the file cannot be read or is not valid YAML
     */
    public static void loadConfigMap(File configFile) throws IOException {
        if (!configFile.isFile()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        Map<String, Object> loaded = yamlMapper.readValue(configFile, new TypeReference<Map<String, Object>>() {
        });
        props = loaded == null ? new HashMap<>() : new HashMap<>(loaded);
        logger.debug("Loaded configuration from {}", configFile);
    }

    public static Object getProperty(String key) {
        return props.get(key);
    }

    public static void setProperty(String key, Object value) {
        props.put(key, value);
    }

    public static void clear() {
        props = new HashMap<>();
    }

    /**
     * Build the effective configuration.
     *
     * @param maxChangedVarsCLI CLI cap on changed variables per block ({@code null} = use YAML/default)
     * @param maxOnlyVarsCLI    CLI cap on listed only-in-one-side variables ({@code null} = use YAML/default)
     * @param labelPrefixCLI    CLI label prefix ({@code null} = use YAML/default)
     */
    public static DiffConfig loadConfig(Integer maxChangedVarsCLI, Integer maxOnlyVarsCLI, String labelPrefixCLI) {
        Map<String, Object> config = section();

        int maxChangedVars = maxChangedVarsCLI != null
                ? maxChangedVarsCLI
                : getInt(config, "max_changed_vars_per_block", DiffConfig.DEFAULT_MAX_CHANGED_VARS_PER_BLOCK);
        int maxOnlyVars = maxOnlyVarsCLI != null
                ? maxOnlyVarsCLI
                : getInt(config, "max_only_vars_shown", DiffConfig.DEFAULT_MAX_ONLY_VARS_SHOWN);
        String labelPrefix = labelPrefixCLI != null
                ? labelPrefixCLI
                : getString(config, "label_prefix", DiffConfig.DEFAULT_LABEL_PREFIX);

        return new DiffConfig(maxChangedVars, maxOnlyVars, labelPrefix);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section() {
        Object raw = props.get(CONFIG_KEY);
        if (raw instanceof Map) {
            return (Map<String, Object>) raw;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            throw new IllegalArgumentException("Expected a number for " + key + ", got: " + value);
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
