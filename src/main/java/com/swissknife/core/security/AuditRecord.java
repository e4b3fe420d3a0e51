package com.swissknife.core.security;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable per-invocation record correlating an execution attempt (allowed
 * or denied) with a redacted preview of its command.
 *
 * @param executionId    128-bit random id as 32 hex characters
 * @param policyProfile  name of the rule set in effect
 * @param tool           tool that issued the attempt, e.g. {@code process.start}
 * @param commandPreview redacted, shell-quoted and length-bounded command
 */
public record AuditRecord(
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("policy_profile") String policyProfile,
    String tool,
    @JsonProperty("command_preview") String commandPreview
) {}
