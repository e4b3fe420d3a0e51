package com.swissknife.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;

/**
 * The bridge's message loop: one frame in, at most one frame out, strictly
 * in order on a single thread.
 */
public class StdioBridge {

    private static final Logger log = LoggerFactory.getLogger(StdioBridge.class);

    private final McpTransport transport;
    private final MessageFraming framing;
    private final ObjectMapper objectMapper;

    public StdioBridge(McpTransport transport, MessageFraming framing, ObjectMapper objectMapper) {
        this.transport = transport;
        this.framing = framing;
        this.objectMapper = objectMapper;
    }

    /**
     * Serves until end of input, an unframed message, or a {@code shutdown} request.
     *
     * @return number of responses written
     */
    public int run(InputStream input, OutputStream output) throws IOException {
        InputStream in = input instanceof BufferedInputStream ? input : new BufferedInputStream(input);
        int responses = 0;
        while (true) {
            Optional<byte[]> frame = framing.readFrame(in);
            if (frame.isEmpty()) {
                log.debug("Input closed; bridge loop ending");
                break;
            }
            JsonNode request;
            try {
                request = objectMapper.readTree(frame.get());
            } catch (JsonProcessingException e) {
                log.warn("Skipping unparseable message: {}", e.getOriginalMessage());
                continue;
            }
            if (request == null || !request.isObject()) {
                log.warn("Skipping non-object message");
                continue;
            }

            Optional<ObjectNode> response = transport.handleRequest(request);
            if (response.isPresent()) {
                framing.writeFrame(output, response.get());
                responses++;
            }
            if ("shutdown".equals(request.path("method").asText(null))) {
                log.info("Shutdown requested; bridge loop ending");
                break;
            }
        }
        return responses;
    }
}
