package com.swissknife.core.catalog;

import java.util.List;

/**
 * Human-facing metadata attached to a tool definition when it is listed.
 */
public record ToolCatalogEntry(
    String category,
    List<String> tags,
    String safetyLevel,
    String preferredUsage,
    int workflowOrder,
    boolean minimalMode,
    Deprecation deprecation
) {
    public static final ToolCatalogEntry UNKNOWN =
            new ToolCatalogEntry("uncategorized", List.of(), "unknown", "", 999, false, null);

    public record Deprecation(String status, String replacement, String guidance) {}
}
