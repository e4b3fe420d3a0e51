package com.swissknife.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RegistryClientTest {

    @Nested
    @DisplayName("normalizeBaseUrl")
    class NormalizeTests {

        @ParameterizedTest
        @CsvSource({
                "http://127.0.0.1:8000/, http://127.0.0.1:8000",
                "https://tools.local/api//, https://tools.local/api",
                "http://localhost:9000/?debug=1#frag, http://localhost:9000",
                "HTTP://Example.com:80, http://Example.com:80"
        })
        @DisplayName("strips trailing slashes, query and fragment")
        void normalizes(String raw, String expected) {
            assertEquals(expected, RegistryClient.normalizeBaseUrl(raw));
        }

        @Test
        @DisplayName("blank falls back to the default")
        void blankDefaults() {
            assertEquals(McpBridgeProperties.DEFAULT_BASE_URL, RegistryClient.normalizeBaseUrl(" "));
            assertEquals(McpBridgeProperties.DEFAULT_BASE_URL, RegistryClient.normalizeBaseUrl(null));
        }

        @Test
        @DisplayName("non-http schemes are rejected")
        void rejectsScheme() {
            var e = assertThrows(IllegalArgumentException.class,
                    () -> RegistryClient.normalizeBaseUrl("ftp://example.com"));
            assertEquals("Base URL must start with http:// or https://", e.getMessage());
            assertThrows(IllegalArgumentException.class, () -> RegistryClient.normalizeBaseUrl("localhost:8000"));
        }

        @Test
        @DisplayName("a URL without a host is rejected")
        void rejectsMissingHost() {
            var e = assertThrows(IllegalArgumentException.class,
                    () -> RegistryClient.normalizeBaseUrl("http:///tools"));
            assertEquals("Base URL must include a host (and optional port)", e.getMessage());
        }
    }

    @Nested
    @DisplayName("HTTP calls")
    class HttpTests {

        private final ObjectMapper objectMapper = new ObjectMapper();
        private final List<String> received = new CopyOnWriteArrayList<>();
        private HttpServer server;
        private RegistryClient client;

        @BeforeEach
        void startServer() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/tools/list", exchange -> reply(exchange, 200,
                    "{\"ok\":true,\"tools\":[{\"name\":\"fs.read\",\"method\":\"POST\",\"path\":\"/fs/read\","
                            + "\"description\":\"Read\",\"request_schema\":{\"type\":\"object\"}},"
                            + "{\"name\":\"health\",\"method\":\"GET\",\"path\":\"/health\"},{\"path\":\"/nameless\"}]}"));
            server.createContext("/fs/read", exchange -> {
                String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
                received.add(exchange.getRequestMethod() + " " + body);
                reply(exchange, 200, "{\"ok\":true,\"content\":\"hi\"}");
            });
            server.createContext("/health", exchange -> {
                received.add(exchange.getRequestMethod() + " " + exchange.getRequestBody().readAllBytes().length);
                reply(exchange, 200, "{\"ok\":true}");
            });
            server.createContext("/broken", exchange -> reply(exchange, 500, "{\"detail\":\"boom\"}"));
            server.createContext("/text", exchange -> reply(exchange, 200, "not json"));
            server.createContext("/slow", exchange -> {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                reply(exchange, 200, "{\"ok\":true}");
            });
            server.start();

            McpBridgeProperties props = new McpBridgeProperties();
            props.setRequestTimeout(Duration.ofMillis(500));
            client = new RegistryClient("http://127.0.0.1:" + server.getAddress().getPort(), props, objectMapper);
        }

        @AfterEach
        void stopServer() {
            server.stop(0);
        }

        private void reply(HttpExchange exchange, int status, String body) throws IOException {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }

        @Test
        @DisplayName("fetchTools keeps named entries keyed by name")
        void fetchTools() {
            Map<String, ToolDefinition> tools = client.fetchTools();
            assertEquals(List.of("fs.read", "health"), List.copyOf(tools.keySet()));
            assertEquals("/fs/read", tools.get("fs.read").path());
            assertEquals("object", tools.get("fs.read").requestSchema().get("type").asText());
            assertNull(tools.get("health").requestSchema());
        }

        @Test
        @DisplayName("POST tools receive the arguments as the JSON body")
        void postsArguments() {
            ToolDefinition tool = new ToolDefinition("fs.read", "POST", "/fs/read", "", null);
            ObjectNode args = objectMapper.createObjectNode().put("path", "a.txt");
            BackendReply reply = client.call(tool, args);
            assertTrue(reply.isOk());
            assertEquals("hi", reply.payload().get("content").asText());
            assertEquals(List.of("POST {\"path\":\"a.txt\"}"), received);
        }

        @Test
        @DisplayName("GET tools are called without a body")
        void getHasNoBody() {
            ToolDefinition tool = new ToolDefinition("health", "GET", "/health", "", null);
            client.call(tool, objectMapper.createObjectNode().put("ignored", true));
            assertEquals(List.of("GET 0"), received);
        }

        @Test
        @DisplayName("non-2xx becomes an http_error payload with status and body")
        void httpError() {
            BackendReply reply = client.get("/broken");
            assertFalse(reply.isOk());
            assertFalse(reply.timedOut());
            assertEquals("http_error", reply.payload().get("error").asText());
            assertEquals(500, reply.payload().get("status").asInt());
            assertEquals("boom", reply.payload().get("response").get("detail").asText());
        }

        @Test
        @DisplayName("non-JSON body becomes invalid_backend_response")
        void invalidBody() {
            BackendReply reply = client.get("/text");
            assertEquals("invalid_backend_response", reply.payload().get("error").asText());
            assertEquals("not json", reply.payload().get("raw").asText());
        }

        @Test
        @DisplayName("slow registry produces a timed-out reply")
        void timeout() {
            BackendReply reply = client.get("/slow");
            assertTrue(reply.timedOut());
            assertEquals("timeout", reply.payload().get("error").asText());
        }

        @Test
        @DisplayName("tool path that is not a valid URI becomes an internal_error reply")
        void invalidPath() {
            ToolDefinition tool = new ToolDefinition("odd", "POST", "/has space{}", "", null);
            BackendReply reply = client.call(tool, objectMapper.createObjectNode());
            assertFalse(reply.isOk());
            assertFalse(reply.timedOut());
            assertEquals("internal_error", reply.payload().get("error").asText());
            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("tool method that is not an HTTP token becomes an internal_error reply")
        void invalidMethod() {
            ToolDefinition tool = new ToolDefinition("odd", "NOT A METHOD", "/fs/read", "", null);
            BackendReply reply = client.call(tool, objectMapper.createObjectNode());
            assertFalse(reply.isOk());
            assertEquals("internal_error", reply.payload().get("error").asText());
            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("unreachable registry yields an empty tool list")
        void unreachable() {
            RegistryClient offline = new RegistryClient("http://127.0.0.1:1", new McpBridgeProperties(), objectMapper);
            assertTrue(offline.fetchTools().isEmpty());
        }
    }
}
