package com.swissknife.mcp;

import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@code Content-Length} framing for the stdio protocol.
 * <p>
 * A frame is a block of {@code Key: Value} header lines terminated by an empty
 * line, followed by exactly {@code Content-Length} bytes of UTF-8 JSON.
 */
public class MessageFraming {

    private static final Logger log = LoggerFactory.getLogger(MessageFraming.class);

    static final String CONTENT_LENGTH = "content-length";

    private final ObjectWriter asciiWriter;

    public MessageFraming(ObjectMapper objectMapper) {
        this.asciiWriter = objectMapper.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII);
    }

    /**
     * Reads the next frame body.
     *
     * @return the body bytes, or empty at end of stream or when the frame
     *         has no positive {@code Content-Length}
     */
    public Optional<byte[]> readFrame(InputStream in) throws IOException {
        Map<String, String> headers = new HashMap<>();
        while (true) {
            String line = readLine(in);
            if (line == null) {
                return Optional.empty();
            }
            if (line.isEmpty()) {
                break;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                log.debug("Skipping malformed header line");
                continue;
            }
            headers.put(line.substring(0, colon).strip().toLowerCase(Locale.ROOT), line.substring(colon + 1).strip());
        }

        int length;
        try {
            length = Integer.parseInt(headers.getOrDefault(CONTENT_LENGTH, "0"));
        } catch (NumberFormatException e) {
            log.warn("Invalid Content-Length header: {}", headers.get(CONTENT_LENGTH));
            return Optional.empty();
        }
        if (length <= 0) {
            return Optional.empty();
        }
        byte[] body = in.readNBytes(length);
        if (body.length < length) {
            log.debug("Stream ended inside a frame body ({} of {} bytes)", body.length, length);
            return Optional.empty();
        }
        return Optional.of(body);
    }

    public void writeFrame(OutputStream out, JsonNode message) throws IOException {
        byte[] data = asciiWriter.writeValueAsBytes(message);
        out.write(("Content-Length: " + data.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
        out.write(data);
        out.flush();
    }

    /**
     * One header line without its {@code \n} or {@code \r\n} terminator;
     * null at end of stream.
     */
    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                byte[] bytes = buffer.toByteArray();
                int len = bytes.length;
                if (len > 0 && bytes[len - 1] == '\r') {
                    len--;
                }
                return new String(bytes, 0, len, StandardCharsets.UTF_8);
            }
            buffer.write(b);
        }
        return buffer.size() > 0 ? buffer.toString(StandardCharsets.UTF_8) : null;
    }
}
