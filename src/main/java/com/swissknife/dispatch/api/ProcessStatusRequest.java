package com.swissknife.dispatch.api;

/** Inbound JSON body for POST /process/status. */
public record ProcessStatusRequest(Long pid) {}
