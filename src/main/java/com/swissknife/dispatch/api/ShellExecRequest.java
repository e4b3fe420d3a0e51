package com.swissknife.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.swissknife.core.security.CommandInput;

import java.util.Map;

/**
 * Inbound JSON body for POST /shell/exec.
 *
 * @param cmd      command string (tokenized) or argv array
 * @param cwd      working directory inside the sandbox; nullable
 * @param env      variables layered over the inherited environment; nullable
 * @param timeoutS seconds to wait before the command is killed; defaults to 60
 */
public record ShellExecRequest(
    CommandInput cmd,
    String cwd,
    Map<String, String> env,
    @JsonProperty("timeout_s") Integer timeoutS
) {
    public ShellExecRequest {
        if (timeoutS == null) timeoutS = 60;
    }
}
