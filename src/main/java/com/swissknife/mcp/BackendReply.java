package com.swissknife.mcp;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Result of one registry call.
 *
 * @param payload  the registry's JSON object, or a synthesized {@code {ok:false, error}} object
 * @param timedOut true when the request timeout elapsed before the registry answered
 */
public record BackendReply(ObjectNode payload, boolean timedOut) {

    /** An absent {@code ok} field counts as success. */
    public boolean isOk() {
        return !payload.has("ok") || payload.get("ok").asBoolean(false);
    }
}
