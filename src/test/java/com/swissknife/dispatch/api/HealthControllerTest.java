package com.swissknife.dispatch.api;

import com.swissknife.core.health.HealthCheckService;
import com.swissknife.core.health.HealthStatus;
import com.swissknife.core.invoke.ToolInvocationService;
import com.swissknife.core.result.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ToolInvocationService invocation;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void passThroughInvocation() {
        when(invocation.execute(anyString(), anyString(), anyString(), isNull(), any()))
                .thenAnswer(call -> ((Supplier<ToolResult>) call.getArgument(4)).get());
    }

    @Test
    @DisplayName("GET /health reports UP when every component is up")
    void healthUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("sandbox", HealthStatus.Status.UP, "Sandbox root available", Map.of()),
                new HealthStatus("supervisor", HealthStatus.Status.UP, "Tracking 0 process(es)", Map.of())));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.sandbox.status").value("UP"));
    }

    @Test
    @DisplayName("GET /health stays ok but reports DOWN components")
    void healthDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("sandbox", HealthStatus.Status.DOWN, "Sandbox root is not a directory", Map.of())));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.sandbox.detail").value("Sandbox root is not a directory"));
    }
}
