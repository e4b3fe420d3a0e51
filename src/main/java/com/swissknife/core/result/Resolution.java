package com.swissknife.core.result;

import java.util.Optional;

/**
 * Outcome of a validation step that either yields a value or names the error
 * kind that stopped it. Used instead of exceptions for expected failures such
 * as an unbalanced quote or a path outside the sandbox.
 *
 * @param value   the resolved value; may be null on success when the input was absent
 * @param error   the error kind, or null on success
 * @param message human-readable reason, or null on success
 */
public record Resolution<T>(T value, ErrorCode error, String message) {

    public static <T> Resolution<T> ok(T value) {
        return new Resolution<>(value, null, null);
    }

    public static <T> Resolution<T> empty() {
        return new Resolution<>(null, null, null);
    }

    public static <T> Resolution<T> failure(ErrorCode error, String message) {
        return new Resolution<>(null, error, message != null ? message : error.defaultMessage());
    }

    public boolean isOk() {
        return error == null;
    }

    public Optional<T> optionalValue() {
        return Optional.ofNullable(value);
    }

    /** Converts a failed resolution into the uniform failure result. */
    public ToolResult toFailure() {
        if (isOk()) {
            throw new IllegalStateException("Resolution succeeded; no failure to convert");
        }
        return ToolResult.failure(error, message);
    }
}
