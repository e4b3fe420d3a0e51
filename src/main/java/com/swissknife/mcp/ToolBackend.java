package com.swissknife.mcp;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * The tool registry as the bridge uses it.
 */
public interface ToolBackend {

    /** Current tool definitions keyed by name; empty if the registry could not be reached. */
    Map<String, ToolDefinition> fetchTools();

    BackendReply call(ToolDefinition tool, ObjectNode arguments);
}
