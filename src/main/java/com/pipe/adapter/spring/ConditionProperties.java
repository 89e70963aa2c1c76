package com.pipe.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the condition engine.
 */
@ConfigurationProperties(prefix = "pipe")
public class ConditionProperties {

    /**
     * Whether the condition engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the scheduler condition configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:pipe-conditions.yaml";

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
