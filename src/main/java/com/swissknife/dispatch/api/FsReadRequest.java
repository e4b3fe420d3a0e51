package com.swissknife.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Inbound JSON body for POST /fs/read. {@code maxBytes} falls back to the sandbox read limit. */
public record FsReadRequest(
    String path,
    @JsonProperty("max_bytes") Integer maxBytes
) {}
