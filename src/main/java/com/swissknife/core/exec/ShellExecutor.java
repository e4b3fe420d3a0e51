package com.swissknife.core.exec;

import com.swissknife.core.fs.TextDecoding;
import com.swissknife.core.logging.MdcContext;
import com.swissknife.core.metrics.SwissknifeMetrics;
import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.Resolution;
import com.swissknife.core.result.ToolResult;
import com.swissknife.core.security.AuditRecord;
import com.swissknife.core.security.CommandInput;
import com.swissknife.core.security.ExecutionPolicyService;
import com.swissknife.core.security.PolicyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs a command to completion and returns its output in the response.
 * Meant for short-lived commands; long-running work belongs in
 * {@link com.swissknife.core.process.ProcessSupervisor}.
 */
@Service
public class ShellExecutor {

    private static final Logger log = LoggerFactory.getLogger(ShellExecutor.class);

    public static final String TOOL_EXEC = "shell.exec";

    private final ExecutionPolicyService policy;
    private final ExecProperties properties;
    private final SwissknifeMetrics metrics;

    public ShellExecutor(ExecutionPolicyService policy, ExecProperties properties, SwissknifeMetrics metrics) {
        this.policy = policy;
        this.properties = properties;
        this.metrics = metrics;
    }

    public ToolResult exec(CommandInput cmd, String cwd, Map<String, String> env, Integer timeoutSeconds) {
        int timeout = timeoutSeconds != null ? timeoutSeconds : properties.getDefaultTimeoutSeconds();

        Resolution<List<String>> argv = policy.normalizeCommand(cmd);
        AuditRecord audit = policy.buildAuditMetadata(
                argv.isOk() ? argv.value() : (cmd != null ? cmd.fallbackArgv() : List.of()), TOOL_EXEC);
        MdcContext.setExecution(TOOL_EXEC, audit.executionId());
        if (!argv.isOk()) {
            metrics.recordPolicyDenial(TOOL_EXEC);
            return ExecutionPolicyService.policyDenied(argv.message(), audit);
        }

        PolicyDecision decision = policy.checkExecutionPolicy(TOOL_EXEC, argv.value(), cwd, env, timeout);
        if (!decision.allowed()) {
            metrics.recordPolicyDenial(TOOL_EXEC);
            return ExecutionPolicyService.policyDenied(decision.reason(), audit);
        }

        Resolution<Path> resolvedCwd = policy.resolvePolicyCwd(cwd);
        if (!resolvedCwd.isOk()) {
            return resolvedCwd.toFailure().with("audit", audit);
        }

        Path stdoutFile = null;
        Path stderrFile = null;
        long started = System.currentTimeMillis();
        try {
            stdoutFile = Files.createTempFile("swissknife-exec-", ".stdout");
            stderrFile = Files.createTempFile("swissknife-exec-", ".stderr");

            ProcessBuilder builder = new ProcessBuilder(argv.value())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            resolvedCwd.optionalValue().ifPresent(dir -> builder.directory(dir.toFile()));
            if (env != null) {
                builder.environment().putAll(env);
            }

            Process process = builder.start();
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeout, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                metrics.recordExecDuration(System.currentTimeMillis() - started, true);
                log.info("Command timed out after {}s: {}", timeout, audit.commandPreview());
                return ToolResult.failure(ErrorCode.TIMEOUT, "Timeout: command exceeded " + timeout + "s")
                        .with("exit_code", -1)
                        .with("stdout", "")
                        .with("stderr", "Timeout: command exceeded " + timeout + "s")
                        .with("audit", audit);
            }

            int exitCode = process.exitValue();
            metrics.recordExecDuration(System.currentTimeMillis() - started, false);
            return ToolResult.ok()
                    .with("ok", exitCode == 0)
                    .with("exit_code", exitCode)
                    .with("stdout", flatten(Files.readAllBytes(stdoutFile)))
                    .with("stderr", flatten(Files.readAllBytes(stderrFile)))
                    .with("timestamp", Instant.now().toString())
                    .with("audit", audit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return execError("Interrupted while waiting for command", audit);
        } catch (IOException | RuntimeException e) {
            log.warn("Command failed to run [{}]: {}", audit.commandPreview(), e.getMessage());
            return execError("Error: " + e.getMessage(), audit);
        } finally {
            deleteTemp(stdoutFile);
            deleteTemp(stderrFile);
        }
    }

    /** Escapes newlines and bounds the text so one command cannot flood a response. */
    String flatten(byte[] output) {
        String text = TextDecoding.decode(output).replace("\n", "\\n");
        int max = properties.getMaxOutputChars();
        return text.length() > max ? text.substring(0, max) : text;
    }

    private static ToolResult execError(String message, AuditRecord audit) {
        return ToolResult.failure(ErrorCode.INTERNAL_ERROR, message)
                .with("exit_code", -2)
                .with("stdout", "")
                .with("stderr", message)
                .with("audit", audit);
    }

    private static void deleteTemp(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", path, e.getMessage());
        }
    }
}
