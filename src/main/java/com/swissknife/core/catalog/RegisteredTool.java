package com.swissknife.core.catalog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base definition of a tool served by the registry: where to call it and
 * what body it accepts.
 */
public record RegisteredTool(String name, String method, String path, String description,
                             Map<String, Object> requestSchema) {

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("method", method);
        map.put("path", path);
        map.put("description", description);
        if (requestSchema != null) {
            map.put("request_schema", requestSchema);
        }
        return map;
    }
}
