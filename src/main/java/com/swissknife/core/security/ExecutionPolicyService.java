package com.swissknife.core.security;

import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.Resolution;
import com.swissknife.core.result.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Gatekeeper consulted before any command is spawned.
 * <p>
 * Stateless apart from the fixed deny-lists, so it is safe to call from any
 * number of request threads at once. Every check reports its outcome as a
 * value; nothing here throws for a denied or malformed request.
 */
@Service
public class ExecutionPolicyService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPolicyService.class);

    static final Set<String> DENY_COMMANDS = Set.of("shutdown", "reboot", "poweroff", "halt", "mkfs");
    static final Set<String> DENY_ENV_EXACT = Set.of("LD_PRELOAD", "DYLD_INSERT_LIBRARIES");
    static final List<String> DENY_ENV_PREFIXES = List.of("BASH_FUNC_");

    private final PolicyProperties policyProperties;
    private final SandboxPathResolver pathResolver;

    public ExecutionPolicyService(PolicyProperties policyProperties, SandboxPathResolver pathResolver) {
        this.policyProperties = policyProperties;
        this.pathResolver = pathResolver;
    }

    /**
     * Turns caller input into argv. Strings are word-split; lists are taken
     * element by element.
     */
    public Resolution<List<String>> normalizeCommand(CommandInput cmd) {
        if (cmd == null) {
            return Resolution.failure(ErrorCode.EMPTY_COMMAND, "empty_command");
        }
        Resolution<List<String>> argv = cmd.isText()
                ? CommandTokenizer.tokenize(cmd.text())
                : Resolution.ok(List.copyOf(cmd.parts()));
        if (argv.isOk() && argv.value().isEmpty()) {
            return Resolution.failure(ErrorCode.EMPTY_COMMAND, "empty_command");
        }
        return argv;
    }

    /**
     * Resolves a working directory against the sandbox root. An absent cwd
     * resolves to an empty value, leaving the OS default in place.
     */
    public Resolution<Path> resolvePolicyCwd(String cwd) {
        if (cwd == null) {
            return Resolution.empty();
        }
        return pathResolver.resolveContained(cwd);
    }

    /**
     * Applies the deny rules in order (command name, cwd containment, timeout
     * ceiling, environment keys) and stops at the first failure.
     */
    public PolicyDecision checkExecutionPolicy(String tool, List<String> argv, String cwd,
                                               Map<String, String> env, Integer timeoutSeconds) {
        String binary = baseName(argv.get(0));
        if (DENY_COMMANDS.contains(binary) || binary.startsWith("mkfs.")) {
            return deny(tool, "command '" + binary + "' is denied");
        }

        if (cwd != null) {
            Resolution<Path> resolved = resolvePolicyCwd(cwd);
            if (!resolved.isOk()) {
                return deny(tool, resolved.message());
            }
        }

        int maxTimeout = policyProperties.getMaxTimeoutSeconds();
        if (timeoutSeconds != null && timeoutSeconds > maxTimeout) {
            return deny(tool, "timeout_s exceeds maximum policy limit (" + maxTimeout + ")");
        }

        if (env != null) {
            for (String key : env.keySet()) {
                if (isDeniedEnvKey(key)) {
                    return deny(tool, "env var '" + key + "' is denied");
                }
            }
        }

        return PolicyDecision.allow();
    }

    public AuditRecord buildAuditMetadata(List<String> argv, String toolName) {
        return new AuditRecord(
                newExecutionId(),
                policyProperties.getProfileName(),
                toolName,
                CommandPreview.render(argv));
    }

    /** The {@code policy_denied} response shape; always carries the audit record. */
    public static ToolResult policyDenied(String reason, AuditRecord audit) {
        String effectiveReason = reason != null ? reason : "policy denied";
        return ToolResult.failure(ErrorCode.POLICY_DENIED, effectiveReason)
                .with("reason", effectiveReason)
                .with("audit", audit);
    }

    public String profileName() {
        return policyProperties.getProfileName();
    }

    public int maxTimeoutSeconds() {
        return policyProperties.getMaxTimeoutSeconds();
    }

    static String newExecutionId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static boolean isDeniedEnvKey(String key) {
        if (DENY_ENV_EXACT.contains(key)) {
            return true;
        }
        for (String prefix : DENY_ENV_PREFIXES) {
            if (key.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String baseName(String executable) {
        String trimmed = executable;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static PolicyDecision deny(String tool, String reason) {
        log.info("Policy denied {}: {}", tool, reason);
        return PolicyDecision.deny(reason);
    }
}
