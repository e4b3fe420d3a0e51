package com.swissknife.dispatch.api;

/** Inbound JSON body for POST /fs/stat. */
public record FsStatRequest(String path) {}
