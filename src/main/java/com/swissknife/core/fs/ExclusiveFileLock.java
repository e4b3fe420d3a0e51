package com.swissknife.core.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Scoped exclusive access to a file through a {@code <name>.lock} sibling.
 * <p>
 * Acquisition creates the lock file atomically and retries with exponential
 * backoff (capped) until the deadline. The lock is released when the
 * try-with-resources block exits, including on exceptions.
 *
 * <pre>{@code
 * try (var lock = ExclusiveFileLock.acquire(target, Duration.ofSeconds(5)).orElseThrow()) {
 *     Files.writeString(target, content);
 * }
 * }</pre>
 */
public final class ExclusiveFileLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExclusiveFileLock.class);

    private static final long INITIAL_BACKOFF_MS = 10;
    private static final long MAX_BACKOFF_MS = 250;

    private final Path lockPath;
    private boolean released;

    private ExclusiveFileLock(Path lockPath) {
        this.lockPath = lockPath;
    }

    public static Path lockPathFor(Path target) {
        return target.resolveSibling(target.getFileName() + ".lock");
    }

    /**
     * Tries to take the lock until {@code timeout} elapses.
     *
     * @return the held lock, or empty if another holder kept it past the deadline
     * @throws IOException if the lock file cannot be created for a reason other than contention
     */
    public static Optional<ExclusiveFileLock> acquire(Path target, Duration timeout) throws IOException {
        Path lockPath = lockPathFor(target);
        long deadline = System.nanoTime() + timeout.toNanos();
        long backoff = INITIAL_BACKOFF_MS;
        while (true) {
            try {
                Files.createFile(lockPath);
                return Optional.of(new ExclusiveFileLock(lockPath));
            } catch (FileAlreadyExistsException e) {
                if (System.nanoTime() >= deadline) {
                    log.debug("Timed out waiting for lock {}", lockPath);
                    return Optional.empty();
                }
            }
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MS);
        }
    }

    public Path lockPath() {
        return lockPath;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        try {
            Files.deleteIfExists(lockPath);
        } catch (IOException e) {
            log.warn("Failed to release lock {}: {}", lockPath, e.getMessage());
        }
    }
}
