package com.swissknife.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for tool calls and process lifecycle.
 */
@Service
public class SwissknifeMetrics {

    private final MeterRegistry registry;

    public SwissknifeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordToolCall(String tool, boolean ok, String error, long ms) {
        Counter.builder("swissknife.tool.calls")
                .tag("tool", tool)
                .tag("outcome", ok ? "ok" : error != null ? error : "unknown_error")
                .register(registry)
                .increment();
        Timer.builder("swissknife.tool.duration")
                .tag("tool", tool)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPolicyDenial(String tool) {
        Counter.builder("swissknife.policy.denials")
                .description("Execution attempts rejected by the policy engine")
                .tag("tool", tool)
                .register(registry)
                .increment();
    }

    public void recordProcessStarted(boolean captureOutput) {
        Counter.builder("swissknife.process.started")
                .tag("capture", String.valueOf(captureOutput))
                .register(registry)
                .increment();
    }

    public void recordProcessKilled(String status) {
        Counter.builder("swissknife.process.kills")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordExecDuration(long ms, boolean timedOut) {
        Timer.builder("swissknife.exec.duration")
                .tag("timed_out", String.valueOf(timedOut))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
