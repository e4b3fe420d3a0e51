package com.swissknife.mcp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A registry tool as seen by the bridge: where to send the call and the
 * schema advertised to the client.
 *
 * @param requestSchema JSON schema of the request body; null if the tool takes none
 */
public record ToolDefinition(String name, String method, String path, String description, JsonNode requestSchema) {

    /** Reads one entry of the registry's {@code tools} array; null if it has no name. */
    public static ToolDefinition fromJson(JsonNode node) {
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            return null;
        }
        JsonNode schema = node.get("request_schema");
        return new ToolDefinition(
                name.asText(),
                node.path("method").asText("POST"),
                node.path("path").asText(""),
                node.path("description").asText(""),
                schema != null && !schema.isNull() ? schema : null);
    }
}
