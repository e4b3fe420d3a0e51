package com.swissknife.core.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform success/failure shape returned by every tool.
 * <p>
 * Serialized as a flat JSON object: {@code {"ok": true, ...}} on success,
 * {@code {"ok": false, "error": "<tag>", "message": "...", ...}} on failure.
 * Field order follows insertion order.
 */
public final class ToolResult {

    public static final String OK = "ok";
    public static final String ERROR = "error";
    public static final String MESSAGE = "message";

    private final Map<String, Object> fields;

    private ToolResult(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static ToolResult ok() {
        var fields = new LinkedHashMap<String, Object>();
        fields.put(OK, true);
        return new ToolResult(fields);
    }

    public static ToolResult failure(ErrorCode code) {
        return failure(code, null);
    }

    public static ToolResult failure(ErrorCode code, String message) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put(OK, false);
        fields.put(ERROR, code.tag());
        fields.put(MESSAGE, message != null ? message : code.defaultMessage());
        return new ToolResult(fields);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ToolResult fromMap(Map<String, Object> raw) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put(OK, raw.getOrDefault(OK, true));
        fields.putAll(raw);
        return new ToolResult(fields);
    }

    /** Adds or replaces a field; returns this result for chaining. */
    public ToolResult with(String key, Object value) {
        fields.put(key, value);
        return this;
    }

    public boolean isOk() {
        return Boolean.TRUE.equals(fields.get(OK));
    }

    /** The error tag, or null for a successful result. */
    public String error() {
        Object error = fields.get(ERROR);
        return error != null ? String.valueOf(error) : null;
    }

    public boolean hasError(ErrorCode code) {
        return code.tag().equals(error());
    }

    public Object get(String key) {
        return fields.get(key);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
