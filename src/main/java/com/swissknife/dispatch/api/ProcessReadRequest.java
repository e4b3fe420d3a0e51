package com.swissknife.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /process/read.
 *
 * @param pid      pid returned by process.start
 * @param stream   {@code stdout} or {@code stderr}; defaults to stdout
 * @param maxBytes upper bound on returned bytes; defaults to 20000
 * @param tail     read the last bytes rather than the first; defaults to true
 */
public record ProcessReadRequest(
    Long pid,
    String stream,
    @JsonProperty("max_bytes") Integer maxBytes,
    Boolean tail
) {
    public ProcessReadRequest {
        if (stream == null) stream = "stdout";
        if (maxBytes == null) maxBytes = 20_000;
        if (tail == null) tail = true;
    }
}
