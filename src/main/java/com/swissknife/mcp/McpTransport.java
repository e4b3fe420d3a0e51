package com.swissknife.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JSON-RPC message handling and capability declaration for the bridge.
 * <p>
 * Stateless apart from the tool cache. Every tool failure becomes an error
 * response; nothing here throws for a bad request.
 */
public class McpTransport {

    private static final Logger log = LoggerFactory.getLogger(McpTransport.class);

    public static final String SERVER_NAME = "ai-agents-swiss-knife";
    public static final String SERVER_VERSION = "0.1.0";
    public static final String PROTOCOL_VERSION = "2024-11-05";

    /** Registry endpoints that are plumbing rather than tools. */
    static final Set<String> HIDDEN_PATHS = Set.of("/health", "/tools/list", "/openapi.json");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ToolBackend backend;
    private final ToolCache cache;
    private final ObjectMapper objectMapper;
    private final boolean enableResources;
    private final boolean enablePrompts;

    public McpTransport(ToolBackend backend, ToolCache cache, ObjectMapper objectMapper,
                        boolean enableResources, boolean enablePrompts) {
        this.backend = backend;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.enableResources = enableResources;
        this.enablePrompts = enablePrompts;
    }

    /**
     * Handles one decoded message.
     *
     * @return the response, or empty for notifications and unknown id-less methods
     */
    public Optional<ObjectNode> handleRequest(JsonNode request) {
        String method = request.path("method").asText(null);
        JsonNode id = request.has("id") ? request.get("id") : NullNode.getInstance();
        boolean hasId = request.has("id") && !request.get("id").isNull();
        JsonNode params = request.get("params");
        if (params == null || params.isNull()) {
            params = NODES.objectNode();
        }

        if (method == null) {
            return hasId ? Optional.of(error(id, McpErrorCodes.METHOD_NOT_FOUND, "Method not found",
                    NODES.objectNode().putNull("method"))) : Optional.empty();
        }
        return switch (method) {
            case "initialize" -> Optional.of(result(id, initializeResult()));
            case "notifications/initialized" -> Optional.empty();
            case "tools/list" -> Optional.of(result(id, toolsList()));
            case "tools/call" -> Optional.of(toolsCall(params, id));
            case "ping", "shutdown" -> Optional.of(result(id, NODES.objectNode()));
            default -> {
                if (!hasId) {
                    log.debug("Dropping unknown notification {}", method);
                    yield Optional.empty();
                }
                yield Optional.of(error(id, McpErrorCodes.METHOD_NOT_FOUND, "Method not found",
                        NODES.objectNode().put("method", method)));
            }
        };
    }

    ObjectNode initializeResult() {
        ObjectNode experimental = NODES.objectNode();
        experimental.set("resources", NODES.objectNode().put("enabled", enableResources));
        experimental.set("prompts", NODES.objectNode().put("enabled", enablePrompts));
        ObjectNode capabilities = NODES.objectNode();
        capabilities.set("tools", NODES.objectNode());
        capabilities.set("experimental", experimental);

        ObjectNode result = NODES.objectNode();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.set("capabilities", capabilities);
        result.set("serverInfo", NODES.objectNode()
                .put("name", SERVER_NAME)
                .put("version", SERVER_VERSION));
        return result;
    }

    private ObjectNode toolsList() {
        Map<String, ToolDefinition> tools = cache.refresh(backend::fetchTools, true);
        ArrayNode listed = NODES.arrayNode();
        for (ToolDefinition tool : tools.values()) {
            if (HIDDEN_PATHS.contains(tool.path())) {
                continue;
            }
            ObjectNode entry = listed.addObject();
            entry.put("name", tool.name());
            entry.put("description", tool.description() != null ? tool.description() : "");
            entry.set("inputSchema", tool.requestSchema() != null
                    ? tool.requestSchema()
                    : NODES.objectNode().put("type", "object"));
        }
        ObjectNode result = NODES.objectNode();
        result.set("tools", listed);
        return result;
    }

    private ObjectNode toolsCall(JsonNode params, JsonNode id) {
        String invalidReason = validateToolCallParams(params);
        if (invalidReason != null) {
            return error(id, McpErrorCodes.INVALID_PARAMS, "Invalid params",
                    NODES.objectNode().put("reason", invalidReason));
        }

        cache.refresh(backend::fetchTools, false);
        String name = params.get("name").asText();
        Optional<ToolDefinition> tool = cache.lookup(name);
        if (tool.isEmpty()) {
            return error(id, McpErrorCodes.INVALID_PARAMS, "Tool not found", NODES.objectNode().put("name", name));
        }

        JsonNode arguments = params.get("arguments");
        ObjectNode body = arguments instanceof ObjectNode object ? object : NODES.objectNode();
        BackendReply reply = backend.call(tool.get(), body);
        if (reply.timedOut()) {
            ObjectNode data = NODES.objectNode().put("tool", name);
            data.set("backend", reply.payload());
            return error(id, McpErrorCodes.BACKEND_TIMEOUT, "Backend timeout", data);
        }
        if (!reply.isOk()) {
            ObjectNode data = NODES.objectNode().put("tool", name);
            data.set("backend", reply.payload());
            return error(id, McpErrorCodes.BACKEND_HTTP_FAILURE, "Backend HTTP failure", data);
        }

        ObjectNode content = NODES.objectNode();
        content.put("type", "text");
        content.put("text", reply.payload().toString());
        ObjectNode result = NODES.objectNode();
        result.set("content", NODES.arrayNode().add(content));
        return result(id, result);
    }

    static String validateToolCallParams(JsonNode params) {
        JsonNode name = params.get("name");
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            return "tools/call params must include a non-empty string `name`.";
        }
        JsonNode arguments = params.get("arguments");
        if (arguments != null && !arguments.isNull() && !arguments.isObject()) {
            return "tools/call `arguments` must be an object when provided.";
        }
        return null;
    }

    private ObjectNode result(JsonNode id, JsonNode result) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("result", result);
        return response;
    }

    private ObjectNode error(JsonNode id, int code, String message, JsonNode data) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("code", code);
        error.put("message", message);
        if (data != null) {
            error.set("data", data);
        }
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("error", error);
        return response;
    }
}
