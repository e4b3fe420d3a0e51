package com.swissknife.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Inbound JSON body for POST /fs/list. */
public record FsListRequest(
    String path,
    Boolean recursive,
    @JsonProperty("max_entries") Integer maxEntries
) {
    public FsListRequest {
        if (recursive == null) recursive = false;
        if (maxEntries == null) maxEntries = 2000;
    }
}
