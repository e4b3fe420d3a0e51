package com.swissknife.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.swissknife.core.security.CommandInput;

import java.util.Map;

/**
 * Inbound JSON body for POST /process/start.
 *
 * @param cmd           command string (tokenized) or argv array
 * @param cwd           working directory inside the sandbox; nullable
 * @param env           variables layered over the inherited environment; nullable
 * @param captureOutput write stdout/stderr to log files; defaults to true
 */
public record ProcessStartRequest(
    CommandInput cmd,
    String cwd,
    Map<String, String> env,
    @JsonProperty("capture_output") Boolean captureOutput
) {
    public ProcessStartRequest {
        if (captureOutput == null) captureOutput = true;
    }
}
