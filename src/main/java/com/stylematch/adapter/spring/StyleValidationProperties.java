package com.stylematch.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for style validation.
 */
@ConfigurationProperties(prefix = "style-match")
public class StyleValidationProperties {

    /**
     * Whether style validation is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the property catalog file.
     * Supports classpath: prefix for classpath resources.
     */
    private String catalogPath = "classpath:style-properties.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCatalogPath() {
        return catalogPath;
    }

    public void setCatalogPath(String catalogPath) {
        this.catalogPath = catalogPath;
    }
}
