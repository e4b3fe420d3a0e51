package com.swissknife.core.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryRecorderTest {

    private TelemetryRecorder recorder;

    @BeforeEach
    void setUp() {
        Clock fixed = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        recorder = new TelemetryRecorder(new ObjectMapper().findAndRegisterModules(), fixed);
    }

    private void recordOk(String name) {
        recorder.recordToolCall(name, "POST", "/x", Map.of(), ToolResult.ok());
    }

    @Nested
    @DisplayName("history")
    class HistoryTests {

        @Test
        @DisplayName("stores newest first with request and response")
        void newestFirst() {
            recorder.recordToolCall("fs.read", "POST", "/fs/read", Map.of("path", "a.txt"),
                    ToolResult.ok().with("content", "hi"));
            recordOk("health");

            TelemetryPage page = recorder.history(0, 20);
            assertEquals(2, page.total());
            JsonNode newest = page.items().get(0);
            assertEquals("health", newest.get("name").asText());
            JsonNode older = page.items().get(1);
            assertEquals("2026-03-01T12:00:00Z", older.get("timestamp").asText());
            assertEquals("/fs/read", older.get("path").asText());
            assertEquals("a.txt", older.get("request").get("path").asText());
            assertEquals("hi", older.get("response").get("content").asText());
            assertTrue(older.get("ok").asBoolean());
        }

        @Test
        @DisplayName("secrets in requests are redacted before storage")
        void redactsRequest() {
            recorder.recordToolCall("shell.exec", "POST", "/shell/exec",
                    Map.of("cmd", "curl -H 'Authorization: Bearer abc.def' --data token=xyz"),
                    ToolResult.ok());
            String stored = recorder.history(0, 1).items().get(0).get("request").get("cmd").asText();
            assertFalse(stored.contains("abc.def"));
            assertFalse(stored.contains("xyz"));
            assertTrue(stored.contains(SecretRedactor.REDACTED));
        }

        @Test
        @DisplayName("is capped at the configured size")
        void capped() {
            for (int i = 0; i < TelemetryRecorder.HISTORY_MAX + 25; i++) {
                recordOk("t" + i);
            }
            TelemetryPage page = recorder.history(0, 1);
            assertEquals(TelemetryRecorder.HISTORY_MAX, page.total());
            assertEquals("t" + (TelemetryRecorder.HISTORY_MAX + 24), page.items().get(0).get("name").asText());
        }

        @Test
        @DisplayName("pagination clamps limit and tolerates offsets past the end")
        void pagination() {
            for (int i = 0; i < 150; i++) {
                recordOk("t" + i);
            }
            TelemetryPage big = recorder.history(0, 1000);
            assertEquals(TelemetryPage.MAX_LIMIT, big.limit());
            assertEquals(TelemetryPage.MAX_LIMIT, big.items().size());

            TelemetryPage window = recorder.history(10, 5);
            assertEquals(5, window.items().size());
            assertEquals("t139", window.items().get(0).get("name").asText());

            TelemetryPage past = recorder.history(500, 5);
            assertEquals(150, past.total());
            assertTrue(past.items().isEmpty());

            assertEquals(1, recorder.history(-3, 0).limit());
            assertEquals(0, recorder.history(-3, 0).offset());
        }

        @Test
        @DisplayName("returned items are copies")
        void copies() {
            recordOk("health");
            ((com.fasterxml.jackson.databind.node.ObjectNode) recorder.history(0, 1).items().get(0)).put("name", "changed");
            assertEquals("health", recorder.history(0, 1).items().get(0).get("name").asText());
        }
    }

    @Nested
    @DisplayName("errors and denials")
    class ErrorTests {

        @Test
        @DisplayName("failures are counted by error tag")
        void countsErrors() {
            recorder.recordToolCall("fs.read", "POST", "/fs/read", Map.of(), ToolResult.failure(ErrorCode.NOT_FOUND));
            recorder.recordToolCall("fs.read", "POST", "/fs/read", Map.of(), ToolResult.failure(ErrorCode.NOT_FOUND));
            recorder.recordToolCall("shell.exec", "POST", "/shell/exec", Map.of(),
                    ToolResult.ok().with("ok", false).with("exit_code", 1));
            recordOk("health");

            assertEquals(Map.of("not_found", 2, "unknown_error", 1), recorder.errorCounters());
        }

        @Test
        @DisplayName("policy and permission denials land in the denial log")
        void logsDenials() {
            recorder.recordToolCall("shell.exec", "POST", "/shell/exec", Map.of(),
                    ToolResult.failure(ErrorCode.POLICY_DENIED, "command 'reboot' is denied")
                            .with("reason", "command 'reboot' is denied"));
            recorder.recordToolCall("fs.read", "POST", "/fs/read", Map.of(),
                    ToolResult.failure(ErrorCode.PERMISSION_DENIED, "Path '../x' resolves outside allowed base directory."));
            recorder.recordToolCall("fs.read", "POST", "/fs/read", Map.of(), ToolResult.failure(ErrorCode.NOT_FOUND));

            TelemetryPage denials = recorder.policyDenials(0, 20);
            assertEquals(2, denials.total());
            JsonNode permission = denials.items().get(0);
            assertEquals("permission_denied", permission.get("error").asText());
            assertEquals("Path '../x' resolves outside allowed base directory.", permission.get("reason").asText());
            JsonNode policy = denials.items().get(1);
            assertEquals("shell.exec", policy.get("name").asText());
            assertEquals("command 'reboot' is denied", policy.get("reason").asText());
        }

        @Test
        @DisplayName("denial log is capped")
        void denialCap() {
            for (int i = 0; i < TelemetryRecorder.DENIALS_MAX + 10; i++) {
                recorder.recordToolCall("shell.exec", "POST", "/shell/exec", Map.of(),
                        ToolResult.failure(ErrorCode.POLICY_DENIED));
            }
            assertEquals(TelemetryRecorder.DENIALS_MAX, recorder.policyDenials(0, 1).total());
            assertEquals(TelemetryRecorder.DENIALS_MAX + 10, recorder.errorCounters().get("policy_denied"));
        }
    }
}
