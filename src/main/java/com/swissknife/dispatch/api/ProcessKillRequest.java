package com.swissknife.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /process/kill.
 *
 * @param pid      pid returned by process.start
 * @param force    escalate to a forced kill if the process survives the graceful wait
 * @param timeoutS seconds to wait after each signal; defaults to 5
 */
public record ProcessKillRequest(
    Long pid,
    Boolean force,
    @JsonProperty("timeout_s") Integer timeoutS
) {
    public ProcessKillRequest {
        if (force == null) force = false;
        if (timeoutS == null) timeoutS = 5;
    }
}
