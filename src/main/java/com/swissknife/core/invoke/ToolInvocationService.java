package com.swissknife.core.invoke;

import com.swissknife.core.logging.MdcContext;
import com.swissknife.core.metrics.SwissknifeMetrics;
import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.ToolResult;
import com.swissknife.core.security.AuditRecord;
import com.swissknife.core.telemetry.TelemetryRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Boundary every registry call passes through. Unexpected exceptions become
 * {@code internal_error} results, and each call is recorded in telemetry and
 * metrics regardless of outcome.
 */
@Service
public class ToolInvocationService {

    private static final Logger log = LoggerFactory.getLogger(ToolInvocationService.class);

    private final TelemetryRecorder telemetry;
    private final SwissknifeMetrics metrics;

    public ToolInvocationService(TelemetryRecorder telemetry, SwissknifeMetrics metrics) {
        this.telemetry = telemetry;
        this.metrics = metrics;
    }

    public ToolResult execute(String name, String method, String path, Object payload, Supplier<ToolResult> action) {
        long started = System.currentTimeMillis();
        MdcContext.setTool(name);
        try {
            ToolResult result;
            try {
                result = action.get();
            } catch (RuntimeException e) {
                log.warn("Tool {} failed unexpectedly: {}", name, e.getMessage(), e);
                result = ToolResult.failure(ErrorCode.INTERNAL_ERROR, e.getMessage());
            }
            if (result.get("audit") instanceof AuditRecord audit) {
                MdcContext.setExecution(name, audit.executionId());
            }
            long elapsed = System.currentTimeMillis() - started;
            log.debug("{} {} -> ok={} error={} ({}ms)", method, path, result.isOk(), result.error(), elapsed);
            telemetry.recordToolCall(name, method, path, payload, result);
            metrics.recordToolCall(name, result.isOk(), result.error(), elapsed);
            return result;
        } finally {
            MdcContext.clear();
        }
    }
}
