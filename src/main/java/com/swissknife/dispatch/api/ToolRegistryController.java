package com.swissknife.dispatch.api;

import com.swissknife.core.catalog.ToolRegistry;
import com.swissknife.core.result.ToolResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller advertising the registry's tools.
 */
@RestController
public class ToolRegistryController {

    private final ToolRegistry toolRegistry;

    public ToolRegistryController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    /** GET /tools/list: enriched definitions sorted by recommended workflow order. */
    @GetMapping("/tools/list")
    public ToolResult listTools() {
        return toolRegistry.list();
    }
}
