package com.swissknife.core.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static usage metadata for every tool the registry serves. Lower
 * workflow order means "reach for this earlier".
 */
public final class ToolCatalog {

    private static final Map<String, ToolCatalogEntry> ENTRIES = Map.ofEntries(
            Map.entry("health", new ToolCatalogEntry("system", List.of("diagnostic", "safe"), "safe",
                    "Call first to confirm server availability.", 0, true, null)),
            Map.entry("shell.exec", new ToolCatalogEntry("execution", List.of("shell", "command", "legacy-behavior"), "high-risk",
                    "Use for short-lived commands only; prefer process.start for long-running jobs.", 80, false,
                    new ToolCatalogEntry.Deprecation("discouraged_for_long_running_tasks", "process.start",
                            "shell.exec waits synchronously and may timeout on long tasks."))),
            Map.entry("fs.read", new ToolCatalogEntry("filesystem", List.of("file", "read", "safe"), "safe",
                    "Read targeted files after discovery with fs.list.", 20, true, null)),
            Map.entry("fs.write", new ToolCatalogEntry("filesystem", List.of("file", "write", "mutation"), "caution",
                    "Use for direct edits; check the target with fs.stat first.", 60, false, null)),
            Map.entry("fs.list", new ToolCatalogEntry("filesystem", List.of("file", "discovery", "safe"), "safe",
                    "Enumerate candidate files before read/write operations.", 10, true, null)),
            Map.entry("fs.stat", new ToolCatalogEntry("filesystem", List.of("metadata", "safe"), "safe",
                    "Confirm path type and size before read/write operations.", 15, true, null)),
            Map.entry("process.start", new ToolCatalogEntry("process", List.of("process", "long-running", "preferred"), "caution",
                    "Preferred for long-running commands and services.", 30, false, null)),
            Map.entry("process.status", new ToolCatalogEntry("process", List.of("process", "monitoring"), "safe",
                    "Track process lifecycle after process.start.", 40, false, null)),
            Map.entry("process.kill", new ToolCatalogEntry("process", List.of("process", "control", "mutation"), "caution",
                    "Terminate server-started processes when work completes or hangs.", 55, false, null)),
            Map.entry("process.read", new ToolCatalogEntry("process", List.of("process", "logs"), "safe",
                    "Read captured stdout/stderr for started processes.", 45, false, null)),
            Map.entry("process.list", new ToolCatalogEntry("process", List.of("process", "inventory"), "safe",
                    "List active tracked processes for cleanup and diagnostics.", 35, false, null))
    );

    private ToolCatalog() {}

    public static ToolCatalogEntry lookup(String toolName) {
        return ENTRIES.getOrDefault(toolName, ToolCatalogEntry.UNKNOWN);
    }

    public static boolean inMinimalMode(String toolName) {
        return lookup(toolName).minimalMode();
    }

    /** Copies the base definition and adds the catalog fields. */
    public static Map<String, Object> enrich(RegisteredTool tool) {
        ToolCatalogEntry entry = lookup(tool.name());
        Map<String, Object> enriched = new LinkedHashMap<>(tool.asMap());
        enriched.put("category", entry.category());
        enriched.put("tags", entry.tags());
        enriched.put("safety_level", entry.safetyLevel());
        enriched.put("preferred_usage", entry.preferredUsage());
        enriched.put("recommended_workflow_order", entry.workflowOrder());
        if (entry.deprecation() != null) {
            ToolCatalogEntry.Deprecation deprecation = entry.deprecation();
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("status", deprecation.status());
            info.put("replacement", deprecation.replacement());
            info.put("guidance", deprecation.guidance());
            enriched.put("deprecation", info);
        }
        return enriched;
    }
}
