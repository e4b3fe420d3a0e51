package com.swissknife.core.catalog;

import com.swissknife.core.result.ToolResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tool definitions advertised at {@code GET /tools/list}.
 */
@Service
public class ToolRegistry {

    static final List<RegisteredTool> BASE_TOOLS = List.of(
            new RegisteredTool("health", "GET", "/health", "Health check", null),
            new RegisteredTool("shell.exec", "POST", "/shell/exec", "Execute a shell command",
                    schema("ShellExecRequest", List.of("cmd"),
                            prop("cmd", commandSchema()),
                            prop("cwd", nullable("string")),
                            prop("env", nullable("object")),
                            prop("timeout_s", withDefault("integer", 60)))),
            new RegisteredTool("fs.read", "POST", "/fs/read", "Read a file",
                    schema("FsReadRequest", List.of("path"),
                            prop("path", type("string")),
                            prop("max_bytes", nullable("integer")))),
            new RegisteredTool("fs.write", "POST", "/fs/write", "Write a file",
                    schema("FsWriteRequest", List.of("path", "content"),
                            prop("path", type("string")),
                            prop("content", type("string")),
                            prop("mode", withDefault("string", "overwrite")))),
            new RegisteredTool("fs.list", "POST", "/fs/list", "List directory contents",
                    schema("FsListRequest", List.of("path"),
                            prop("path", type("string")),
                            prop("recursive", withDefault("boolean", false)),
                            prop("max_entries", nullable("integer")))),
            new RegisteredTool("fs.stat", "POST", "/fs/stat", "Stat a file or directory",
                    schema("FsStatRequest", List.of("path"),
                            prop("path", type("string")))),
            new RegisteredTool("process.start", "POST", "/process/start", "Start a process",
                    schema("ProcessStartRequest", List.of("cmd"),
                            prop("cmd", commandSchema()),
                            prop("cwd", nullable("string")),
                            prop("env", nullable("object")),
                            prop("capture_output", withDefault("boolean", true)))),
            new RegisteredTool("process.status", "POST", "/process/status", "Process status",
                    schema("ProcessStatusRequest", List.of("pid"),
                            prop("pid", type("integer")))),
            new RegisteredTool("process.kill", "POST", "/process/kill", "Kill a process started by the server",
                    schema("ProcessKillRequest", List.of("pid"),
                            prop("pid", type("integer")),
                            prop("force", withDefault("boolean", false)),
                            prop("timeout_s", withDefault("integer", 5)))),
            new RegisteredTool("process.read", "POST", "/process/read", "Read process output",
                    schema("ProcessReadRequest", List.of("pid"),
                            prop("pid", type("integer")),
                            prop("stream", withDefault("string", "stdout")),
                            prop("max_bytes", withDefault("integer", 20000)),
                            prop("tail", withDefault("boolean", true)))),
            new RegisteredTool("process.list", "POST", "/process/list", "List server-started processes", null)
    );

    private final CatalogProperties properties;

    public ToolRegistry(CatalogProperties properties) {
        this.properties = properties;
    }

    public List<RegisteredTool> baseTools() {
        return BASE_TOOLS;
    }

    public ToolResult list() {
        boolean minimal = properties.isMinimalMode();
        List<Map<String, Object>> tools = new ArrayList<>();
        for (RegisteredTool tool : BASE_TOOLS) {
            if (!minimal || ToolCatalog.inMinimalMode(tool.name())) {
                tools.add(ToolCatalog.enrich(tool));
            }
        }
        tools.sort(Comparator.comparingInt(t -> (Integer) t.get("recommended_workflow_order")));
        return ToolResult.ok()
                .with("minimal_mode", minimal)
                .with("tools", tools);
    }

    // schema helpers

    @SafeVarargs
    private static Map<String, Object> schema(String title, List<String> required, Map.Entry<String, Object>... properties) {
        Map<String, Object> props = new LinkedHashMap<>();
        Arrays.stream(properties).forEach(p -> props.put(p.getKey(), p.getValue()));
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("title", title);
        schema.put("type", "object");
        schema.put("properties", props);
        schema.put("required", required);
        return schema;
    }

    private static Map.Entry<String, Object> prop(String name, Object schema) {
        return Map.entry(name, schema);
    }

    private static Map<String, Object> type(String type) {
        return Map.of("type", type);
    }

    private static Map<String, Object> nullable(String type) {
        return Map.of("anyOf", List.of(Map.of("type", type), Map.of("type", "null")));
    }

    private static Map<String, Object> withDefault(String type, Object defaultValue) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type);
        schema.put("default", defaultValue);
        return schema;
    }

    private static Map<String, Object> commandSchema() {
        return Map.of("anyOf", List.of(
                Map.of("type", "string"),
                Map.of("type", "array", "items", Map.of("type", "string"))));
    }
}
