package com.swissknife.dispatch.api;

/** Inbound JSON body for POST /fs/write. */
public record FsWriteRequest(String path, String content, String mode) {
    public FsWriteRequest {
        if (mode == null) mode = "overwrite";
    }
}
