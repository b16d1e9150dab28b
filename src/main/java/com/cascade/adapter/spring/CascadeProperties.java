package com.cascade.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Cascade.
 */
@ConfigurationProperties(prefix = "cascade")
public class CascadeProperties {

    /**
     * Whether Cascade is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Cascade configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:cascade.yaml";

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
