package com.swissknife.mcp;

import com.swissknife.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolCacheTest {

    private MutableClock clock;
    private AtomicInteger loads;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        loads = new AtomicInteger();
    }

    private Map<String, ToolDefinition> load() {
        loads.incrementAndGet();
        return Map.of("health", new ToolDefinition("health", "GET", "/health", "", null));
    }

    @Test
    @DisplayName("empty cache always needs a refresh")
    void emptyNeedsRefresh() {
        ToolCache cache = new ToolCache(Duration.ofSeconds(5), clock);
        assertTrue(cache.needsRefresh());
        cache.refresh(this::load, false);
        assertFalse(cache.needsRefresh());
    }

    @Test
    @DisplayName("refresh is skipped inside the TTL and repeated after it")
    void ttl() {
        ToolCache cache = new ToolCache(Duration.ofSeconds(5), clock);
        cache.refresh(this::load, false);
        clock.advance(Duration.ofSeconds(4));
        cache.refresh(this::load, false);
        assertEquals(1, loads.get());

        clock.advance(Duration.ofSeconds(1));
        cache.refresh(this::load, false);
        assertEquals(2, loads.get());
        assertEquals(clock.instant(), cache.refreshedAt());
    }

    @Test
    @DisplayName("zero TTL refreshes on every call")
    void zeroTtl() {
        ToolCache cache = new ToolCache(Duration.ZERO, clock);
        cache.refresh(this::load, false);
        cache.refresh(this::load, false);
        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("forced refresh ignores the TTL")
    void forced() {
        ToolCache cache = new ToolCache(Duration.ofMinutes(1), clock);
        cache.refresh(this::load, false);
        cache.refresh(this::load, true);
        assertEquals(2, loads.get());
    }

    @Test
    @DisplayName("lookup finds cached tools by name")
    void lookup() {
        ToolCache cache = new ToolCache(Duration.ofSeconds(5), clock);
        cache.refresh(this::load, false);
        assertTrue(cache.lookup("health").isPresent());
        assertTrue(cache.lookup("nope").isEmpty());
    }
}
