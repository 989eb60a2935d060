package org.txc.appsec.definition;

import java.time.Duration;
import java.util.Properties;

/**
 * SDK-wide settings read from the bundled {@code config.properties}.
 */
public class SdkConfig {
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private String edgercPath = "~/.edgerc";
    private String edgercSection = EdgeGridConfigLoader.DEFAULT_SECTION;

    public SdkConfig() {
    }

    public static SdkConfig fromProperties(Properties prop) throws ConfigException {
        SdkConfig config = new SdkConfig();
        config.setConnectTimeout(seconds(prop, "appsec.http.connect-timeout-seconds", config.getConnectTimeout()));
        config.setRequestTimeout(seconds(prop, "appsec.http.request-timeout-seconds", config.getRequestTimeout()));
        config.setEdgercPath(prop.getProperty("appsec.edgerc.path", config.getEdgercPath()));
        config.setEdgercSection(prop.getProperty("appsec.edgerc.section", config.getEdgercSection()));
        return config;
    }

    private static Duration seconds(Properties prop, String key, Duration fallback) throws ConfigException {
        String raw = prop.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new ConfigException(ConfigException.Reason.INVALID_VALUE, key + " is not a number: " + raw, e);
        }
    }

    // Getters and Setters
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public String getEdgercPath() { return edgercPath; }
    public void setEdgercPath(String edgercPath) { this.edgercPath = edgercPath; }
    public String getEdgercSection() { return edgercSection; }
    public void setEdgercSection(String edgercSection) { this.edgercSection = edgercSection; }
}
