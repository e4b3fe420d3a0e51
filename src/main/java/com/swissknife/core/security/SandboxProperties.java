package com.swissknife.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Sandbox root configuration.
 *
 * <pre>
 * swissknife:
 *   sandbox:
 *     base-dir: /srv/agent-workspace
 *     max-read-bytes: 200000
 * </pre>
 *
 * A blank {@code base-dir} confines tools to the process working directory.
 */
@Component
@ConfigurationProperties(prefix = "swissknife.sandbox")
public class SandboxProperties {

    private String baseDir = "";
    private int maxReadBytes = 200_000;

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
    public int getMaxReadBytes() { return maxReadBytes; }
    public void setMaxReadBytes(int maxReadBytes) { this.maxReadBytes = maxReadBytes; }

    public Path getBasePath() {
        if (baseDir == null || baseDir.isBlank()) {
            return Path.of("").toAbsolutePath().normalize();
        }
        return Path.of(baseDir).toAbsolutePath().normalize();
    }
}
