package com.swissknife.dispatch.api;

import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.ToolResult;
import org.springframework.http.ResponseEntity;

/**
 * Shared response helpers for the tool controllers.
 */
final class ToolResponses {

    private ToolResponses() {}

    /** 422 for a request body that lacks a required field; the call never reaches the tool. */
    static ResponseEntity<ToolResult> missingField(String field) {
        return ResponseEntity.unprocessableEntity().body(
                ToolResult.failure(ErrorCode.INVALID_ARGUMENT, "Field '" + field + "' is required")
                        .with("field", field));
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
