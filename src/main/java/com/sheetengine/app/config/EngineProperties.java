package com.sheetengine.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code sheetengine} prefix.
 */
@ConfigurationProperties(prefix = "sheetengine")
public class EngineProperties {

    private int defaultRows = 1000;
    private int defaultCols = 26;
    private int defaultPrecision = 15;
    private String defaultDateSystem = "1900";
    // How long a saved document stays in the cache
    private Duration cacheTtl = Duration.ofSeconds(300);
    // How long a writer waits for the document lock before giving up
    private Duration lockTimeout = Duration.ofSeconds(5);

    public int getDefaultRows() {
        return defaultRows;
    }

    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultCols() {
        return defaultCols;
    }

    public void setDefaultCols(int defaultCols) {
        this.defaultCols = defaultCols;
    }

    public int getDefaultPrecision() {
        return defaultPrecision;
    }

    public void setDefaultPrecision(int defaultPrecision) {
        this.defaultPrecision = defaultPrecision;
    }

    public String getDefaultDateSystem() {
        return defaultDateSystem;
    }

    public void setDefaultDateSystem(String defaultDateSystem) {
        this.defaultDateSystem = defaultDateSystem;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }
}
