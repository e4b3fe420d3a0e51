package com.swissknife.core.telemetry;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page of a newest-first telemetry log.
 */
public record TelemetryPage(int total, int offset, int limit, List<JsonNode> items) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    static TelemetryPage slice(List<JsonNode> all, int offset, int limit) {
        int safeOffset = Math.max(offset, 0);
        int safeLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
        int from = Math.min(safeOffset, all.size());
        int to = Math.min(from + safeLimit, all.size());
        List<JsonNode> items = all.subList(from, to).stream()
                .map(JsonNode::deepCopy)
                .map(JsonNode.class::cast)
                .toList();
        return new TelemetryPage(all.size(), safeOffset, safeLimit, items);
    }
}
