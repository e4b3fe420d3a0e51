package com.swissknife.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the tool registry.
 * <p>
 * Every call has a finite request timeout. Transport and protocol failures
 * never throw; they come back as {@code {ok:false, error}} payloads so the
 * bridge can turn them into protocol errors.
 */
public class RegistryClient implements ToolBackend {

    private static final Logger log = LoggerFactory.getLogger(RegistryClient.class);

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RegistryClient(String baseUrl, McpBridgeProperties properties, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.requestTimeout = properties.getRequestTimeout();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        this.objectMapper = objectMapper;
    }

    /**
     * Validates a registry base URL and strips the trailing slash, query and fragment.
     *
     * @throws IllegalArgumentException if the URL is not http(s) or has no host
     */
    public static String normalizeBaseUrl(String raw) {
        String candidate = raw != null && !raw.isBlank() ? raw.strip() : McpBridgeProperties.DEFAULT_BASE_URL;
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Base URL is not a valid URL: " + candidate, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Base URL must start with http:// or https://");
        }
        String authority = uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            throw new IllegalArgumentException("Base URL must include a host (and optional port)");
        }
        String path = uri.getRawPath() != null ? uri.getRawPath() : "";
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return scheme.toLowerCase() + "://" + authority + path;
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public Map<String, ToolDefinition> fetchTools() {
        BackendReply reply = send("GET", "/tools/list", null);
        Map<String, ToolDefinition> tools = new LinkedHashMap<>();
        if (!reply.isOk()) {
            log.warn("Could not fetch tool list from {}: {}", baseUrl, reply.payload().path("error").asText());
            return tools;
        }
        for (JsonNode node : reply.payload().path("tools")) {
            ToolDefinition tool = ToolDefinition.fromJson(node);
            if (tool != null) {
                tools.put(tool.name(), tool);
            }
        }
        return tools;
    }

    @Override
    public BackendReply call(ToolDefinition tool, ObjectNode arguments) {
        String method = tool.method() != null ? tool.method() : "POST";
        return send(method, tool.path(), "GET".equalsIgnoreCase(method) ? null : arguments);
    }

    public BackendReply get(String path) {
        return send("GET", path, null);
    }

    BackendReply send(String method, String path, ObjectNode body) {
        URI uri;
        HttpRequest request;
        try {
            uri = URI.create(baseUrl + path);
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json");
            if (body != null) {
                builder.method(method.toUpperCase(), HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
            } else {
                builder.method(method.toUpperCase(), HttpRequest.BodyPublishers.noBody());
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            // registry-supplied path or method that cannot form a request
            log.warn("Cannot build {} request for {}: {}", method, path, e.getMessage());
            return new BackendReply(failure("internal_error").put("message", String.valueOf(e.getMessage())), false);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            log.warn("{} {} timed out after {}", method, uri, requestTimeout);
            return new BackendReply(failure("timeout")
                    .put("message", "Registry did not answer within " + requestTimeout.toMillis() + "ms"), true);
        } catch (IOException e) {
            log.warn("{} {} failed: {}", method, uri, e.getMessage());
            return new BackendReply(failure("internal_error").put("message", String.valueOf(e.getMessage())), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new BackendReply(failure("internal_error").put("message", "Interrupted"), false);
        }

        int status = response.statusCode();
        String raw = response.body() != null ? response.body() : "";
        if (status < 200 || status >= 300) {
            ObjectNode error = failure("http_error");
            error.put("status", status);
            try {
                error.set("response", objectMapper.readTree(raw));
            } catch (JsonProcessingException e) {
                error.put("response", raw);
            }
            return new BackendReply(error, false);
        }
        try {
            JsonNode parsed = objectMapper.readTree(raw);
            if (parsed instanceof ObjectNode object) {
                return new BackendReply(object, false);
            }
        } catch (JsonProcessingException e) {
            log.debug("Registry returned non-JSON body for {} {}", method, path);
        }
        return new BackendReply(failure("invalid_backend_response").put("raw", raw), false);
    }

    private ObjectNode failure(String error) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("ok", false);
        node.put("error", error);
        return node;
    }
}
