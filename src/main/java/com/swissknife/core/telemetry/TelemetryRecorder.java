package com.swissknife.core.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory record of recent tool calls, policy denials and error counts.
 * <p>
 * Payloads are converted to JSON trees and redacted before they are stored,
 * so nothing retained here can leak a secret the caller passed in. All state
 * is guarded by the recorder's monitor.
 */
@Service
public class TelemetryRecorder {

    private static final Logger log = LoggerFactory.getLogger(TelemetryRecorder.class);

    static final int HISTORY_MAX = 500;
    static final int DENIALS_MAX = 200;

    static final String NO_ERROR = "none";
    static final String UNKNOWN_ERROR = "unknown_error";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Deque<JsonNode> history = new ArrayDeque<>();
    private final Deque<JsonNode> denials = new ArrayDeque<>();
    private final Map<String, Integer> errorCounters = new LinkedHashMap<>();

    public TelemetryRecorder(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    TelemetryRecorder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void recordToolCall(String name, String method, String path, Object request, ToolResult response) {
        String now = Instant.now(clock).toString();
        boolean ok = response.isOk();
        String errorKey = ok ? NO_ERROR : errorKeyOf(response);

        ObjectNode entry = JsonNodeFactory.instance.objectNode();
        entry.put("timestamp", now);
        entry.put("name", name);
        entry.put("method", method);
        entry.put("path", path);
        entry.put("ok", ok);
        entry.set("request", sanitize(toTree(request), null));
        entry.set("response", sanitize(toTree(response), null));

        synchronized (this) {
            pushBounded(history, entry, HISTORY_MAX);
            if (!ok) {
                errorCounters.merge(errorKey, 1, Integer::sum);
                if (isDenial(errorKey)) {
                    ObjectNode denial = JsonNodeFactory.instance.objectNode();
                    denial.put("timestamp", now);
                    denial.put("name", name);
                    denial.put("path", path);
                    denial.put("error", SecretRedactor.redact(errorKey));
                    Object reason = response.get("reason") != null ? response.get("reason") : response.get(ToolResult.MESSAGE);
                    if (reason != null) {
                        denial.put("reason", SecretRedactor.redact(String.valueOf(reason)));
                    }
                    pushBounded(denials, denial, DENIALS_MAX);
                }
            }
        }
    }

    public TelemetryPage history(int offset, int limit) {
        List<JsonNode> items;
        synchronized (this) {
            items = new ArrayList<>(history);
        }
        return TelemetryPage.slice(items, offset, limit);
    }

    public TelemetryPage policyDenials(int offset, int limit) {
        List<JsonNode> items;
        synchronized (this) {
            items = new ArrayList<>(denials);
        }
        return TelemetryPage.slice(items, offset, limit);
    }

    public synchronized Map<String, Integer> errorCounters() {
        return new LinkedHashMap<>(errorCounters);
    }

    private static boolean isDenial(String errorKey) {
        return errorKey.equals(ErrorCode.POLICY_DENIED.tag())
                || errorKey.equals(ErrorCode.PERMISSION_DENIED.tag());
    }

    private static String errorKeyOf(ToolResult response) {
        Object error = response.get(ToolResult.ERROR);
        if (error instanceof String s && !s.isEmpty()) {
            return s;
        }
        return UNKNOWN_ERROR;
    }

    private JsonNode toTree(Object value) {
        if (value == null) {
            return JsonNodeFactory.instance.objectNode();
        }
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            log.debug("Could not convert telemetry payload: {}", e.getMessage());
            return TextNode.valueOf(String.valueOf(value));
        }
    }

    /** Redacts every string in the tree; the enclosing key decides the length bound. */
    static JsonNode sanitize(JsonNode node, String key) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), sanitize(field.getValue(), field.getKey()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                copy.add(sanitize(element, key));
            }
            return copy;
        }
        if (node.isTextual()) {
            return TextNode.valueOf(SecretRedactor.redactField(key, node.textValue()));
        }
        return node;
    }

    private static void pushBounded(Deque<JsonNode> deque, JsonNode entry, int max) {
        deque.addFirst(entry);
        while (deque.size() > max) {
            deque.removeLast();
        }
    }
}
