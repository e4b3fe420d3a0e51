package com.swissknife.mcp;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Name-to-definition cache of the registry's tools with a refresh TTL.
 * Confined to the bridge thread; not thread-safe.
 */
public class ToolCache {

    private final Duration ttl;
    private final Clock clock;

    private Map<String, ToolDefinition> tools = Map.of();
    private Instant refreshedAt = Instant.EPOCH;

    public ToolCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /** Empty, expired or TTL-disabled caches need a refresh. */
    public boolean needsRefresh() {
        if (tools.isEmpty()) {
            return true;
        }
        if (ttl.isZero() || ttl.isNegative()) {
            return true;
        }
        return !clock.instant().isBefore(refreshedAt.plus(ttl));
    }

    public Map<String, ToolDefinition> refresh(Supplier<Map<String, ToolDefinition>> loader, boolean force) {
        if (force || needsRefresh()) {
            tools = new LinkedHashMap<>(loader.get());
            refreshedAt = clock.instant();
        }
        return tools;
    }

    public Optional<ToolDefinition> lookup(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Map<String, ToolDefinition> snapshot() {
        return Map.copyOf(tools);
    }

    public Instant refreshedAt() {
        return refreshedAt;
    }
}
