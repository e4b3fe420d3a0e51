package com.swissknife.core.fs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExclusiveFileLockTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("lock file sits next to the target")
    void lockPathIsSibling() {
        Path target = tempDir.resolve("notes.txt");
        assertEquals(tempDir.resolve("notes.txt.lock"), ExclusiveFileLock.lockPathFor(target));
    }

    @Test
    @DisplayName("lock file exists while held and is removed on close")
    void acquireAndRelease() throws Exception {
        Path target = tempDir.resolve("a.txt");
        try (ExclusiveFileLock lock = ExclusiveFileLock.acquire(target, Duration.ofSeconds(1)).orElseThrow()) {
            assertTrue(Files.exists(lock.lockPath()));
        }
        assertFalse(Files.exists(ExclusiveFileLock.lockPathFor(target)));
    }

    @Test
    @DisplayName("second acquirer times out while the first holds the lock")
    void contendedTimesOut() throws Exception {
        Path target = tempDir.resolve("b.txt");
        try (ExclusiveFileLock held = ExclusiveFileLock.acquire(target, Duration.ofSeconds(1)).orElseThrow()) {
            Optional<ExclusiveFileLock> second = ExclusiveFileLock.acquire(target, Duration.ofMillis(100));
            assertTrue(second.isEmpty());
        }
        Optional<ExclusiveFileLock> after = ExclusiveFileLock.acquire(target, Duration.ofMillis(100));
        assertTrue(after.isPresent());
        after.get().close();
    }

    @Test
    @DisplayName("waiter gets the lock once the holder releases it")
    void waiterAcquiresAfterRelease() throws Exception {
        Path target = tempDir.resolve("c.txt");
        ExclusiveFileLock first = ExclusiveFileLock.acquire(target, Duration.ofSeconds(1)).orElseThrow();
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            first.close();
        });
        releaser.start();
        Optional<ExclusiveFileLock> second = ExclusiveFileLock.acquire(target, Duration.ofSeconds(5));
        releaser.join();
        assertTrue(second.isPresent());
        second.get().close();
    }

    @Test
    @DisplayName("closing twice is harmless")
    void idempotentClose() throws Exception {
        Path target = tempDir.resolve("d.txt");
        ExclusiveFileLock lock = ExclusiveFileLock.acquire(target, Duration.ofSeconds(1)).orElseThrow();
        lock.close();
        ExclusiveFileLock other = ExclusiveFileLock.acquire(target, Duration.ofSeconds(1)).orElseThrow();
        lock.close();
        assertTrue(Files.exists(other.lockPath()));
        other.close();
    }
}
