package com.swissknife.dispatch.api;

import com.swissknife.core.health.HealthCheckService;
import com.swissknife.core.health.HealthStatus;
import com.swissknife.core.invoke.ToolInvocationService;
import com.swissknife.core.result.ToolResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for registry liveness.
 */
@RestController
public class HealthController {

    private final ToolInvocationService invocation;
    private final HealthCheckService healthCheckService;

    public HealthController(ToolInvocationService invocation,
                            @Autowired(required = false) HealthCheckService healthCheckService) {
        this.invocation = invocation;
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /health. Always answers {@code ok: true} while the server is up;
     * {@code status} reports DOWN if any component check is DOWN.
     */
    @GetMapping("/health")
    public ToolResult health() {
        return invocation.execute("health", "GET", "/health", null, this::checkComponents);
    }

    private ToolResult checkComponents() {
        if (healthCheckService == null) {
            return ToolResult.ok().with("status", "UP").with("components", Map.of());
        }
        boolean anyDown = false;
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : healthCheckService.checkAll()) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);
            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            }
        }
        return ToolResult.ok()
                .with("status", anyDown ? "DOWN" : "UP")
                .with("components", components);
    }
}
