package com.dredd.config;

import com.dredd.exception.RuleConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads engine configuration from YAML files.
 * <p>
 * Keys may sit at the document root or under a {@code dredd} section:
 * <pre>
 * dredd:
 *   name: pricing-rules
 *   max-depth: 32
 *   context-capacity: 64
 *   trace-enabled: true
 * </pre>
 * {@code max-depth} 0 (the default) means no depth limit.
 * Missing keys fall back to {@link RuleEngineConfig#defaults()}.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static RuleEngineConfig load(String path) {
        log.info("Loading rule engine configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new RuleConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path == null || path.isBlank()) {
            throw new RuleConfigurationException("Configuration path cannot be empty");
        }
        if (path.startsWith("classpath:")) {
            return new ClassPathResource(path.substring("classpath:".length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static RuleEngineConfig parse(InputStream inputStream) {
        Object loaded = new Yaml().load(inputStream);
        if (loaded == null) {
            log.warn("Configuration file is empty, using defaults");
            return RuleEngineConfig.defaults();
        }
        if (!(loaded instanceof Map)) {
            throw new RuleConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        Object section = root.containsKey("dredd") ? root.get("dredd") : root;
        if (!(section instanceof Map)) {
            throw new RuleConfigurationException("'dredd' section must be a mapping");
        }
        Map<String, Object> engine = (Map<String, Object>) section;

        RuleEngineConfig config = new RuleEngineConfig(
                getString(engine, "name", RuleEngineConfig.DEFAULT_NAME),
                getInt(engine, "max-depth", RuleEngineConfig.UNLIMITED_DEPTH),
                getInt(engine, "context-capacity", RuleEngineConfig.DEFAULT_CONTEXT_CAPACITY),
                getBoolean(engine, "trace-enabled", false)
        );

        log.info("Loaded rule engine configuration: {} (max depth {}, context capacity {}, trace {})",
                config.name(), config.hasDepthLimit() ? config.maxDepth() : "unlimited",
                config.contextCapacity(), config.traceEnabled());
        return config;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new RuleConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) return true;
        if (text.equalsIgnoreCase("false")) return false;
        throw new RuleConfigurationException("'" + key + "' must be true or false, got: " + value);
    }
}
