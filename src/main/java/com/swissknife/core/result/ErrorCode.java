package com.swissknife.core.result;

/**
 * Error taxonomy shared by every tool response. The {@link #tag()} is the
 * literal value carried in the {@code error} field on the wire.
 */
public enum ErrorCode {

    INVALID_COMMAND("invalid_command", "Command could not be parsed."),
    EMPTY_COMMAND("empty_command", "Command is empty."),
    POLICY_DENIED("policy_denied", "Execution denied by policy."),
    NOT_FOUND("not_found", "Requested resource was not found."),
    TIMEOUT("timeout", "Operation timed out."),
    NO_OUTPUT("no_output", "Output capture was disabled for this process."),
    PERMISSION_DENIED("permission_denied", "Operation is not permitted in the allowed base directory."),
    INVALID_PATH("invalid_path", "Provided path or path-like input is invalid."),
    INVALID_ARGUMENT("invalid_argument", "Provided argument is invalid."),
    INTERNAL_ERROR("internal_error", "Unexpected internal error.");

    private final String tag;
    private final String defaultMessage;

    ErrorCode(String tag, String defaultMessage) {
        this.tag = tag;
        this.defaultMessage = defaultMessage;
    }

    public String tag() {
        return tag;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
