package com.swissknife.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the stdio bridge.
 *
 * <pre>
 * swissknife:
 *   bridge:
 *     base-url: http://127.0.0.1:8000
 *     tools-cache-ttl: 5s
 *     request-timeout: 10s
 *     connect-timeout: 5s
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "swissknife.bridge")
public class McpBridgeProperties {

    public static final String DEFAULT_BASE_URL = "http://127.0.0.1:8000";

    private String baseUrl = DEFAULT_BASE_URL;
    /** Zero or negative refreshes the tool list before every call. */
    private Duration toolsCacheTtl = Duration.ofSeconds(5);
    private Duration requestTimeout = Duration.ofSeconds(10);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private boolean enableResources = false;
    private boolean enablePrompts = false;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public Duration getToolsCacheTtl() { return toolsCacheTtl; }
    public void setToolsCacheTtl(Duration toolsCacheTtl) { this.toolsCacheTtl = toolsCacheTtl; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public boolean isEnableResources() { return enableResources; }
    public void setEnableResources(boolean enableResources) { this.enableResources = enableResources; }
    public boolean isEnablePrompts() { return enablePrompts; }
    public void setEnablePrompts(boolean enablePrompts) { this.enablePrompts = enablePrompts; }
}
