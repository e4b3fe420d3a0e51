package com.swissknife.core.process;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Process supervisor settings.
 *
 * <pre>
 * swissknife:
 *   process:
 *     work-dir-name: .mcp/process
 *     retention: 0s            # 0 keeps exited entries for the life of the server
 *     default-kill-timeout-seconds: 5
 *     default-read-bytes: 20000
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "swissknife.process")
public class ProcessProperties {

    private String workDirName = ".mcp/process";
    private Duration retention = Duration.ZERO;
    private int defaultKillTimeoutSeconds = 5;
    private int defaultReadBytes = 20_000;

    public String getWorkDirName() { return workDirName; }
    public void setWorkDirName(String workDirName) { this.workDirName = workDirName; }
    public Duration getRetention() { return retention; }
    public void setRetention(Duration retention) { this.retention = retention; }
    public int getDefaultKillTimeoutSeconds() { return defaultKillTimeoutSeconds; }
    public void setDefaultKillTimeoutSeconds(int defaultKillTimeoutSeconds) { this.defaultKillTimeoutSeconds = defaultKillTimeoutSeconds; }
    public int getDefaultReadBytes() { return defaultReadBytes; }
    public void setDefaultReadBytes(int defaultReadBytes) { this.defaultReadBytes = defaultReadBytes; }

    public boolean isRetentionEnabled() {
        return retention != null && !retention.isZero() && !retention.isNegative();
    }
}
