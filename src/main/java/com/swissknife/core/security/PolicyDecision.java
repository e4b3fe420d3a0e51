package com.swissknife.core.security;

/**
 * Result of an execution policy check.
 *
 * @param allowed whether the command may run
 * @param reason  human-readable denial reason; null when allowed
 */
public record PolicyDecision(boolean allowed, String reason) {

    public static PolicyDecision allow() {
        return new PolicyDecision(true, null);
    }

    public static PolicyDecision deny(String reason) {
        return new PolicyDecision(false, reason);
    }
}
