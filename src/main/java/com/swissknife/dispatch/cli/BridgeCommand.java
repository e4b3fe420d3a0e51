package com.swissknife.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swissknife.mcp.McpBridgeProperties;
import com.swissknife.mcp.McpTransport;
import com.swissknife.mcp.MessageFraming;
import com.swissknife.mcp.RegistryClient;
import com.swissknife.mcp.StdioBridge;
import com.swissknife.mcp.ToolCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * CLI command: swissknife bridge [--base-url URL] [--print-config]
 * <p>
 * Speaks the framed stdio protocol on stdin/stdout and proxies tool calls to
 * the HTTP registry. Stdout carries protocol frames only; logs go to stderr.
 */
@Command(name = "bridge", mixinStandardHelpOptions = true,
        description = "Run the MCP stdio bridge against a running registry")
@Component
public class BridgeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BridgeCommand.class);

    static final int EXIT_INVALID_CONFIG = 2;

    private final McpBridgeProperties properties;
    private final ObjectMapper objectMapper;

    private InputStream in = System.in;
    private PrintStream out = System.out;
    private PrintStream err = System.err;

    @Option(names = "--base-url", description = "Registry base URL (overrides swissknife.bridge.base-url)")
    private String baseUrl;

    @Option(names = "--print-config", description = "Print validated bridge connection settings as JSON and exit")
    private boolean printConfig;

    public BridgeCommand(McpBridgeProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /** Replaces the process streams; used by tests. */
    BridgeCommand withStreams(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
        return this;
    }

    @Override
    public Integer call() throws IOException {
        String resolvedUrl;
        try {
            resolvedUrl = RegistryClient.normalizeBaseUrl(baseUrl != null ? baseUrl : properties.getBaseUrl());
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_INVALID_CONFIG;
        }

        RegistryClient client = new RegistryClient(resolvedUrl, properties, objectMapper);
        if (printConfig) {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(describe(client)));
            return 0;
        }

        log.info("Bridging stdio to registry at {}", resolvedUrl);
        McpTransport transport = new McpTransport(client,
                new ToolCache(properties.getToolsCacheTtl(), Clock.systemUTC()),
                objectMapper, properties.isEnableResources(), properties.isEnablePrompts());
        StdioBridge bridge = new StdioBridge(transport, new MessageFraming(objectMapper), objectMapper);
        int responses = bridge.run(in, out);
        log.info("Bridge finished after {} response(s)", responses);
        return 0;
    }

    private ObjectNode describe(RegistryClient client) {
        String url = client.baseUrl();
        ObjectNode config = objectMapper.createObjectNode();
        config.put("server", McpTransport.SERVER_NAME);
        config.put("version", McpTransport.SERVER_VERSION);
        config.put("protocolVersion", McpTransport.PROTOCOL_VERSION);
        config.put("baseUrl", url);
        config.put("healthUrl", url + "/health");
        config.put("toolsUrl", url + "/tools/list");
        config.set("health", client.get("/health").payload());
        ObjectNode bridgeCommand = config.putObject("bridgeCommand");
        bridgeCommand.put("command", "swissknife");
        bridgeCommand.putArray("args").add("bridge");
        bridgeCommand.putObject("env").put("SWISSKNIFE_BRIDGE_BASE_URL", url);
        return config;
    }
}
