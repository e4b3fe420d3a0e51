package com.swissknife.mcp;

/**
 * JSON-RPC error codes emitted by the bridge.
 */
public final class McpErrorCodes {

    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int BACKEND_HTTP_FAILURE = -32010;
    public static final int BACKEND_TIMEOUT = -32011;

    private McpErrorCodes() {}
}
