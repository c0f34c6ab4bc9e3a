package com.dredd.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the rule engine.
 */
@ConfigurationProperties(prefix = "dredd")
public class RuleEngineProperties {

    /**
     * Whether the rule engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the engine configuration file.
     * Supports classpath: prefix for classpath resources. When unset, defaults are used.
     */
    private String configPath;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
