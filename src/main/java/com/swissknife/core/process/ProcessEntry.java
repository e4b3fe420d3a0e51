package com.swissknife.core.process;

import com.swissknife.core.security.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A child process owned by {@link ProcessSupervisor}.
 * <p>
 * Captured output is written by the child straight into the log files, so the
 * only handles the server holds are the process pipe endpoints. They are
 * released once, the first time the process is seen to have exited. The exit
 * code is cached at that point and never re-queried.
 */
public final class ProcessEntry {

    private static final Logger log = LoggerFactory.getLogger(ProcessEntry.class);

    private final String executionId;
    private final Process process;
    private final long pid;
    private final List<String> argv;
    private final Path cwd;
    private final Instant startTime;
    private final boolean captureOutput;
    private final Path stdoutPath;
    private final Path stderrPath;
    private final AuditRecord audit;

    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean terminating;
    private volatile Integer exitCode;
    private volatile Instant exitObservedAt;

    ProcessEntry(String executionId, Process process, List<String> argv, Path cwd, Instant startTime,
                 boolean captureOutput, Path stdoutPath, Path stderrPath, AuditRecord audit) {
        this.executionId = executionId;
        this.process = process;
        this.pid = process.pid();
        this.argv = List.copyOf(argv);
        this.cwd = cwd;
        this.startTime = startTime;
        this.captureOutput = captureOutput;
        this.stdoutPath = stdoutPath;
        this.stderrPath = stderrPath;
        this.audit = audit;
    }

    public enum State { RUNNING, TERMINATING, EXITED }

    /**
     * Non-blocking poll. Returns the exit code once the process has exited,
     * otherwise null. The first observed exit releases the output handles.
     */
    Integer poll(Clock clock) {
        Integer cached = exitCode;
        if (cached != null) {
            return cached;
        }
        if (process.isAlive()) {
            return null;
        }
        int code = process.exitValue();
        exitCode = code;
        exitObservedAt = clock.instant();
        releaseOutput();
        return code;
    }

    /** Closes the pipe endpoints held by the server; safe to call repeatedly. */
    void releaseOutput() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        closeHandle(process.getOutputStream());
        closeHandle(process.getInputStream());
        closeHandle(process.getErrorStream());
    }

    void markTerminating() {
        terminating = true;
    }

    Process process() { return process; }

    public State state() {
        if (exitCode != null) return State.EXITED;
        return terminating ? State.TERMINATING : State.RUNNING;
    }

    public String executionId() { return executionId; }
    public long pid() { return pid; }
    public List<String> argv() { return argv; }
    public Path cwd() { return cwd; }
    public Instant startTime() { return startTime; }
    public boolean captureOutput() { return captureOutput; }
    public Path stdoutPath() { return stdoutPath; }
    public Path stderrPath() { return stderrPath; }
    public AuditRecord audit() { return audit; }
    public Integer exitCode() { return exitCode; }
    public Instant exitObservedAt() { return exitObservedAt; }
    public boolean isReleased() { return released.get(); }

    private void closeHandle(Closeable handle) {
        try {
            handle.close();
        } catch (IOException e) {
            log.debug("Error closing handle for pid {}: {}", pid, e.getMessage());
        }
    }
}
