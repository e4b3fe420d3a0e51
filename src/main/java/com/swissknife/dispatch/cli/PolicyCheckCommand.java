package com.swissknife.dispatch.cli;

import com.swissknife.core.exec.ShellExecutor;
import com.swissknife.core.result.Resolution;
import com.swissknife.core.security.AuditRecord;
import com.swissknife.core.security.CommandInput;
import com.swissknife.core.security.ExecutionPolicyService;
import com.swissknife.core.security.PolicyDecision;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: swissknife check [--cwd DIR] [--timeout S] [--env K=V]... -- CMD...
 * <p>
 * Evaluates the execution policy without running anything. A single
 * argument is tokenized like a shell command string; several arguments are
 * taken as argv. Exits 0 when allowed, 1 when denied.
 */
@Command(name = "check", mixinStandardHelpOptions = true,
        description = "Evaluate the execution policy for a command without running it")
@Component
public class PolicyCheckCommand implements Callable<Integer> {

    private final ExecutionPolicyService policy;

    @Option(names = "--cwd", description = "Working directory the command would run in")
    private String cwd;

    @Option(names = "--timeout", description = "Timeout in seconds the command would request")
    private Integer timeoutSeconds;

    @Option(names = "--env", description = "Environment override KEY=VALUE (repeatable)")
    private Map<String, String> env = new LinkedHashMap<>();

    @Option(names = "--tool", defaultValue = ShellExecutor.TOOL_EXEC,
            description = "Tool name recorded in the audit (default: ${DEFAULT-VALUE})")
    private String tool;

    @Parameters(arity = "1..*", paramLabel = "CMD", description = "Command string or argv")
    private List<String> command;

    public PolicyCheckCommand(ExecutionPolicyService policy) {
        this.policy = policy;
    }

    @Override
    public Integer call() {
        CommandInput input = command.size() == 1 ? CommandInput.of(command.get(0)) : CommandInput.of(command);
        Resolution<List<String>> argv = policy.normalizeCommand(input);
        AuditRecord audit = policy.buildAuditMetadata(argv.isOk() ? argv.value() : input.fallbackArgv(), tool);

        PolicyDecision decision = argv.isOk()
                ? policy.checkExecutionPolicy(tool, argv.value(), cwd, env, timeoutSeconds)
                : PolicyDecision.deny(argv.message());

        if (decision.allowed()) {
            ConsoleOutput.success("allowed");
        } else {
            ConsoleOutput.error("denied: " + decision.reason());
        }
        ConsoleOutput.detail("profile", audit.policyProfile());
        ConsoleOutput.detail("preview", audit.commandPreview());
        ConsoleOutput.detail("execution_id", audit.executionId());
        return decision.allowed() ? 0 : 1;
    }
}
