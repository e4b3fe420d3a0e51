package com.swissknife.core.process;

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
import com.swissknife.core.security.SandboxPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Owns the lifecycle of server-spawned child processes.
 * <p>
 * Entries are keyed by the audit execution id; the OS pid is a secondary
 * index that always points at the newest entry for that pid, so a recycled
 * pid never aliases onto a stale process.
 * <p>
 * One lock guards both maps. It is held only for map reads and writes; polls,
 * waits and file I/O run on an entry reference taken out of the lock.
 */
@Service
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    public static final String TOOL_START = "process.start";

    private final ExecutionPolicyService policy;
    private final SandboxPathResolver pathResolver;
    private final ProcessProperties properties;
    private final SwissknifeMetrics metrics;
    private final Clock clock;

    private final Object tableLock = new Object();
    private final Map<String, ProcessEntry> entries = new LinkedHashMap<>();
    private final Map<Long, String> pidIndex = new HashMap<>();

    @Autowired
    public ProcessSupervisor(ExecutionPolicyService policy,
                             SandboxPathResolver pathResolver,
                             ProcessProperties properties,
                             SwissknifeMetrics metrics) {
        this(policy, pathResolver, properties, metrics, Clock.systemUTC());
    }

    ProcessSupervisor(ExecutionPolicyService policy,
                      SandboxPathResolver pathResolver,
                      ProcessProperties properties,
                      SwissknifeMetrics metrics,
                      Clock clock) {
        this.policy = policy;
        this.pathResolver = pathResolver;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Policy-checks and spawns a process. With {@code captureOutput} its
     * stdout and stderr go to fresh log files under the sandbox work dir;
     * otherwise both are discarded.
     */
    public ToolResult start(CommandInput cmd, String cwd, Map<String, String> env, boolean captureOutput) {
        Resolution<List<String>> argv = policy.normalizeCommand(cmd);
        AuditRecord audit = policy.buildAuditMetadata(
                argv.isOk() ? argv.value() : fallbackArgv(cmd), TOOL_START);
        MdcContext.setExecution(TOOL_START, audit.executionId());
        if (!argv.isOk()) {
            metrics.recordPolicyDenial(TOOL_START);
            return ExecutionPolicyService.policyDenied(argv.message(), audit);
        }

        PolicyDecision decision = policy.checkExecutionPolicy(TOOL_START, argv.value(), cwd, env, null);
        if (!decision.allowed()) {
            metrics.recordPolicyDenial(TOOL_START);
            return ExecutionPolicyService.policyDenied(decision.reason(), audit);
        }

        Resolution<Path> resolvedCwd = policy.resolvePolicyCwd(cwd);
        if (!resolvedCwd.isOk()) {
            return resolvedCwd.toFailure().with("audit", audit);
        }

        pruneExpired();

        Path stdoutPath = null;
        Path stderrPath = null;
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(argv.value());
            resolvedCwd.optionalValue().ifPresent(dir -> builder.directory(dir.toFile()));
            if (env != null) {
                builder.environment().putAll(env);
            }
            if (captureOutput) {
                Path workDir = ensureWorkDir();
                String token = UUID.randomUUID().toString().replace("-", "");
                stdoutPath = Files.createFile(workDir.resolve(token + ".stdout.log"));
                stderrPath = Files.createFile(workDir.resolve(token + ".stderr.log"));
                builder.redirectOutput(ProcessBuilder.Redirect.appendTo(stdoutPath.toFile()));
                builder.redirectError(ProcessBuilder.Redirect.appendTo(stderrPath.toFile()));
            } else {
                builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
                builder.redirectError(ProcessBuilder.Redirect.DISCARD);
            }
            process = builder.start();
        } catch (IOException | RuntimeException e) {
            deleteLog(stdoutPath);
            deleteLog(stderrPath);
            log.warn("Failed to start process [{}]: {}", audit.commandPreview(), e.getMessage());
            return ToolResult.failure(ErrorCode.INTERNAL_ERROR, e.getMessage()).with("audit", audit);
        }

        // The child reads EOF on stdin; nothing is ever written to it.
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }

        ProcessEntry entry = new ProcessEntry(audit.executionId(), process, argv.value(),
                resolvedCwd.value(), clock.instant(), captureOutput, stdoutPath, stderrPath, audit);
        synchronized (tableLock) {
            entries.put(entry.executionId(), entry);
            pidIndex.put(entry.pid(), entry.executionId());
        }
        metrics.recordProcessStarted(captureOutput);
        log.info("Started pid {} (execution {}): {}", entry.pid(), entry.executionId(), audit.commandPreview());

        return ToolResult.ok()
                .with("pid", entry.pid())
                .with("execution_id", entry.executionId())
                .with("cwd", pathString(entry.cwd()))
                .with("stdout_path", pathString(stdoutPath))
                .with("stderr_path", pathString(stderrPath))
                .with("audit", audit);
    }

    public ToolResult status(long pid) {
        ProcessEntry entry = lookup(pid);
        if (entry == null) {
            return notFound(pid);
        }
        return describe(entry);
    }

    /**
     * Terminates a tracked process: graceful signal first, then (only with
     * {@code force}) a forcible kill after {@code timeoutSeconds}.
     */
    public ToolResult kill(long pid, boolean force, int timeoutSeconds) {
        ProcessEntry entry = lookup(pid);
        if (entry == null) {
            return notFound(pid);
        }
        Integer exitCode = entry.poll(clock);
        if (exitCode != null) {
            return ToolResult.ok().with("status", "exited").with("returncode", exitCode);
        }

        Process process = entry.process();
        entry.markTerminating();
        try {
            process.destroy();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                if (!force) {
                    metrics.recordProcessKilled("timeout");
                    return ToolResult.failure(ErrorCode.TIMEOUT,
                            "Process " + pid + " did not exit within " + timeoutSeconds + "s");
                }
                log.info("Pid {} ignored termination; forcing kill", pid);
                process.destroyForcibly();
                if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                    metrics.recordProcessKilled("timeout");
                    return ToolResult.failure(ErrorCode.TIMEOUT,
                            "Process " + pid + " did not exit after forced kill");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ErrorCode.INTERNAL_ERROR, "Interrupted while waiting for process " + pid);
        }

        Integer returnCode = entry.poll(clock);
        metrics.recordProcessKilled("terminated");
        log.info("Terminated pid {} (returncode {})", pid, returnCode);
        return ToolResult.ok().with("status", "terminated").with("returncode", returnCode);
    }

    /**
     * Reads up to {@code maxBytes} of captured output, from the end of the
     * file when {@code tail} is set.
     */
    public ToolResult read(long pid, String stream, int maxBytes, boolean tail) {
        ProcessEntry entry = lookup(pid);
        if (entry == null) {
            return notFound(pid);
        }
        if (!entry.captureOutput()) {
            return ToolResult.failure(ErrorCode.NO_OUTPUT);
        }
        Path path;
        if ("stdout".equals(stream)) {
            path = entry.stdoutPath();
        } else if ("stderr".equals(stream)) {
            path = entry.stderrPath();
        } else {
            return ToolResult.failure(ErrorCode.INVALID_ARGUMENT, "stream must be 'stdout' or 'stderr'");
        }
        if (maxBytes <= 0) {
            return ToolResult.failure(ErrorCode.INVALID_ARGUMENT, "max_bytes must be positive");
        }
        if (path == null) {
            return ToolResult.failure(ErrorCode.NO_OUTPUT);
        }
        if (!Files.exists(path)) {
            return ToolResult.failure(ErrorCode.NOT_FOUND, "Log file missing: " + path);
        }

        long size;
        byte[] data;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            size = channel.size();
            long offset = tail && size > maxBytes ? size - maxBytes : 0;
            int toRead = (int) Math.min(maxBytes, size - offset);
            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            channel.position(offset);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            data = Arrays.copyOf(buffer.array(), buffer.position());
        } catch (IOException e) {
            log.warn("Failed to read {} of pid {}: {}", stream, pid, e.getMessage());
            return ToolResult.failure(ErrorCode.INTERNAL_ERROR, e.getMessage());
        }

        return ToolResult.ok()
                .with("pid", pid)
                .with("stream", stream)
                .with("size", size)
                .with("content", TextDecoding.decode(data))
                .with("truncated", data.length < size);
    }

    public ToolResult list() {
        pruneExpired();
        List<Map<String, Object>> processes = new ArrayList<>();
        for (ProcessEntry entry : entriesSnapshot()) {
            processes.add(describe(entry).asMap());
        }
        return ToolResult.ok().with("processes", processes);
    }

    /** Lightweight per-process view for the dashboard feed. */
    public List<Map<String, Object>> snapshot() {
        List<Map<String, Object>> items = new ArrayList<>();
        for (ProcessEntry entry : entriesSnapshot()) {
            Integer exitCode = entry.poll(clock);
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("pid", entry.pid());
            item.put("running", exitCode == null);
            item.put("returncode", exitCode);
            item.put("cmd", entry.argv());
            item.put("cwd", pathString(entry.cwd()));
            item.put("start_time", entry.startTime());
            item.put("capture_output", entry.captureOutput());
            items.add(item);
        }
        return items;
    }

    public int trackedCount() {
        synchronized (tableLock) {
            return entries.size();
        }
    }

    public Path workDir() {
        return pathResolver.root().resolve(properties.getWorkDirName());
    }

    /**
     * Drops exited entries whose exit was observed longer ago than the
     * configured retention. No-op when retention is disabled.
     */
    void pruneExpired() {
        if (!properties.isRetentionEnabled()) {
            return;
        }
        Instant cutoff = clock.instant().minus(properties.getRetention());
        List<ProcessEntry> evicted = new ArrayList<>();
        synchronized (tableLock) {
            var iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                ProcessEntry entry = iterator.next();
                Instant exitedAt = entry.exitObservedAt();
                if (exitedAt != null && exitedAt.isBefore(cutoff)) {
                    iterator.remove();
                    pidIndex.remove(entry.pid(), entry.executionId());
                    evicted.add(entry);
                }
            }
        }
        for (ProcessEntry entry : evicted) {
            deleteLog(entry.stdoutPath());
            deleteLog(entry.stderrPath());
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} exited process entries", evicted.size());
        }
    }

    private ToolResult describe(ProcessEntry entry) {
        Integer exitCode = entry.poll(clock);
        return ToolResult.ok()
                .with("pid", entry.pid())
                .with("execution_id", entry.executionId())
                .with("running", exitCode == null)
                .with("state", entry.state().name().toLowerCase())
                .with("returncode", exitCode)
                .with("cmd", entry.argv())
                .with("cwd", pathString(entry.cwd()))
                .with("start_time", entry.startTime())
                .with("stdout_path", pathString(entry.stdoutPath()))
                .with("stderr_path", pathString(entry.stderrPath()))
                .with("capture_output", entry.captureOutput())
                .with("audit", entry.audit());
    }

    private ProcessEntry lookup(long pid) {
        synchronized (tableLock) {
            String executionId = pidIndex.get(pid);
            if (executionId == null) {
                return null;
            }
            ProcessEntry entry = entries.get(executionId);
            return entry != null && entry.pid() == pid ? entry : null;
        }
    }

    private List<ProcessEntry> entriesSnapshot() {
        synchronized (tableLock) {
            return new ArrayList<>(entries.values());
        }
    }

    private Path ensureWorkDir() throws IOException {
        return Files.createDirectories(workDir());
    }

    private static List<String> fallbackArgv(CommandInput cmd) {
        return cmd != null ? cmd.fallbackArgv() : List.of();
    }

    private static ToolResult notFound(long pid) {
        return ToolResult.failure(ErrorCode.NOT_FOUND, "No tracked process with pid " + pid);
    }

    private static String pathString(Path path) {
        return path != null ? path.toString() : null;
    }

    private static void deleteLog(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete log file {}: {}", path, e.getMessage());
        }
    }
}
