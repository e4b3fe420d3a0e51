package com.swissknife.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Execution policy settings.
 * <p>
 * The deny-lists themselves are fixed in {@link ExecutionPolicyService}; only
 * the profile label and the timeout ceiling are configurable.
 */
@Component
@ConfigurationProperties(prefix = "swissknife.policy")
public class PolicyProperties {

    private String profileName = "default-restricted-v1";
    private int maxTimeoutSeconds = 300;

    public String getProfileName() { return profileName; }
    public void setProfileName(String profileName) { this.profileName = profileName; }
    public int getMaxTimeoutSeconds() { return maxTimeoutSeconds; }
    public void setMaxTimeoutSeconds(int maxTimeoutSeconds) { this.maxTimeoutSeconds = maxTimeoutSeconds; }
}
