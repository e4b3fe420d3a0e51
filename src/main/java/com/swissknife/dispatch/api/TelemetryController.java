package com.swissknife.dispatch.api;

import com.swissknife.core.process.ProcessSupervisor;
import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.ToolResult;
import com.swissknife.core.telemetry.TelemetryPage;
import com.swissknife.core.telemetry.TelemetryRecorder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller exposing recorded tool-call telemetry and the dashboard feed.
 */
@RestController
public class TelemetryController {

    private final TelemetryRecorder telemetry;
    private final ProcessSupervisor supervisor;

    public TelemetryController(TelemetryRecorder telemetry, ProcessSupervisor supervisor) {
        this.telemetry = telemetry;
        this.supervisor = supervisor;
    }

    @GetMapping("/telemetry/history")
    public ResponseEntity<ToolResult> history(@RequestParam(defaultValue = "0") int offset,
                                              @RequestParam(defaultValue = "20") int limit) {
        if (!validPage(offset, limit)) {
            return invalidPage();
        }
        return ResponseEntity.ok(page(telemetry.history(offset, limit)));
    }

    @GetMapping("/telemetry/policy_denials")
    public ResponseEntity<ToolResult> policyDenials(@RequestParam(defaultValue = "0") int offset,
                                                    @RequestParam(defaultValue = "20") int limit) {
        if (!validPage(offset, limit)) {
            return invalidPage();
        }
        return ResponseEntity.ok(page(telemetry.policyDenials(offset, limit)));
    }

    @GetMapping("/telemetry/error_counters")
    public ToolResult errorCounters() {
        return ToolResult.ok().with("error_counters", telemetry.errorCounters());
    }

    /** GET /gui/data: one-shot snapshot for a dashboard poller. */
    @GetMapping("/gui/data")
    public ResponseEntity<ToolResult> guiData(
            @RequestParam(name = "history_offset", defaultValue = "0") int historyOffset,
            @RequestParam(name = "history_limit", defaultValue = "10") int historyLimit,
            @RequestParam(name = "policy_offset", defaultValue = "0") int policyOffset,
            @RequestParam(name = "policy_limit", defaultValue = "10") int policyLimit) {
        if (!validPage(historyOffset, historyLimit) || !validPage(policyOffset, policyLimit)) {
            return invalidPage();
        }
        List<Map<String, Object>> processes = supervisor.snapshot();
        return ResponseEntity.ok(ToolResult.ok()
                .with("health", Map.of("ok", true))
                .with("history", telemetry.history(historyOffset, historyLimit))
                .with("policy_denials", telemetry.policyDenials(policyOffset, policyLimit))
                .with("error_counters", telemetry.errorCounters())
                .with("processes", Map.of("total", processes.size(), "items", processes)));
    }

    private static ToolResult page(TelemetryPage page) {
        return ToolResult.ok()
                .with("total", page.total())
                .with("offset", page.offset())
                .with("limit", page.limit())
                .with("items", page.items());
    }

    private static boolean validPage(int offset, int limit) {
        return offset >= 0 && limit >= 1 && limit <= TelemetryPage.MAX_LIMIT;
    }

    private static ResponseEntity<ToolResult> invalidPage() {
        return ResponseEntity.unprocessableEntity().body(
                ToolResult.failure(ErrorCode.INVALID_ARGUMENT,
                        "offset must be >= 0 and limit between 1 and " + TelemetryPage.MAX_LIMIT));
    }
}
