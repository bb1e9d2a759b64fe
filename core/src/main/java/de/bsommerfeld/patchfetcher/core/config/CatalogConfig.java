package de.bsommerfeld.patchfetcher.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection parameters for the catalog service. Defaults target the public
 * update service and only need changing for proxies or test endpoints.
 */
public class CatalogConfig {

    @JsonProperty("base_url")
    private String baseUrl = "https://updates.oracle.com";

    /**
     * The service only accepts Basic authentication from non-browser agents,
     * so the default mimics wget.
     */
    @JsonProperty("user_agent")
    private String userAgent = "Wget/1.20.3";

    @JsonProperty("max_attempts")
    private int maxAttempts = 3;

    @JsonProperty("session_ttl_minutes")
    private long sessionTtlMinutes = 60;

    @JsonProperty("timeout_seconds")
    private long timeoutSeconds = 60;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getSessionTtlMinutes() {
        return sessionTtlMinutes;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
