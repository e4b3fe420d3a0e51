package com.swissknife.core.fs;

import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.Resolution;
import com.swissknife.core.result.ToolResult;
import com.swissknife.core.security.SandboxPathResolver;
import com.swissknife.core.security.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Single-shot file operations confined to the sandbox root.
 */
@Service
public class FileSystemTools {

    private static final Logger log = LoggerFactory.getLogger(FileSystemTools.class);

    static final Duration WRITE_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final SandboxPathResolver pathResolver;
    private final SandboxProperties sandboxProperties;

    public FileSystemTools(SandboxPathResolver pathResolver, SandboxProperties sandboxProperties) {
        this.pathResolver = pathResolver;
        this.sandboxProperties = sandboxProperties;
    }

    public ToolResult read(String path, Integer maxBytes) {
        int limit = maxBytes != null && maxBytes > 0 ? maxBytes : sandboxProperties.getMaxReadBytes();
        Resolution<Path> resolved = pathResolver.resolve(path);
        if (!resolved.isOk()) {
            return resolved.toFailure();
        }
        Path file = resolved.value();
        if (!Files.exists(file)) {
            return ToolResult.failure(ErrorCode.NOT_FOUND, "File not found: " + path);
        }
        if (Files.isDirectory(file)) {
            return ToolResult.failure(ErrorCode.INVALID_PATH, "Expected a file but got directory: " + path);
        }
        try (InputStream in = Files.newInputStream(file)) {
            long size = Files.size(file);
            byte[] content = in.readNBytes(limit);
            return ToolResult.ok()
                    .with("path", file.toString())
                    .with("size", size)
                    .with("content", TextDecoding.decode(content))
                    .with("truncated", size > limit);
        } catch (IOException e) {
            return fromIOException(e, path);
        }
    }

    /**
     * Writes text under an exclusive lock. {@code mode} is {@code overwrite}
     * or {@code append}; parent directories are created as needed.
     */
    public ToolResult write(String path, String content, String mode) {
        String effectiveMode = mode != null ? mode : "overwrite";
        if (!effectiveMode.equals("overwrite") && !effectiveMode.equals("append")) {
            return ToolResult.failure(ErrorCode.INVALID_ARGUMENT, "Unsupported mode: " + effectiveMode);
        }
        Resolution<Path> resolved = pathResolver.resolve(path);
        if (!resolved.isOk()) {
            return resolved.toFailure();
        }
        Path file = resolved.value();
        try {
            Files.createDirectories(file.getParent());
            Optional<ExclusiveFileLock> lock = ExclusiveFileLock.acquire(file, WRITE_LOCK_TIMEOUT);
            if (lock.isEmpty()) {
                return ToolResult.failure(ErrorCode.TIMEOUT, "File is locked by another writer: " + path);
            }
            try (ExclusiveFileLock held = lock.get()) {
                byte[] bytes = (content != null ? content : "").getBytes(StandardCharsets.UTF_8);
                if (effectiveMode.equals("append")) {
                    Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                } else {
                    Files.write(file, bytes);
                }
            }
            log.debug("Wrote {} ({})", file, effectiveMode);
            return ToolResult.ok().with("path", file.toString());
        } catch (IOException e) {
            return fromIOException(e, path);
        }
    }

    public ToolResult list(String path, boolean recursive, Integer maxEntries) {
        int limit = maxEntries != null && maxEntries > 0 ? maxEntries : 2000;
        Resolution<Path> resolved = pathResolver.resolve(path);
        if (!resolved.isOk()) {
            return resolved.toFailure();
        }
        Path dir = resolved.value();
        if (!Files.exists(dir)) {
            return ToolResult.failure(ErrorCode.NOT_FOUND, "Directory not found: " + path);
        }
        if (!Files.isDirectory(dir)) {
            return ToolResult.failure(ErrorCode.INVALID_PATH, "Expected a directory but got file: " + path);
        }

        Path root = pathResolver.root();
        List<Map<String, Object>> entries = new ArrayList<>();
        boolean truncated = false;
        try (Stream<Path> stream = recursive ? Files.walk(dir).skip(1) : Files.list(dir)) {
            Iterator<Path> iterator = stream.iterator();
            while (iterator.hasNext()) {
                Path entry = iterator.next();
                if (entries.size() >= limit) {
                    truncated = true;
                    break;
                }
                entries.add(describe(entry, root));
            }
        } catch (IOException e) {
            return fromIOException(e, path);
        }
        return ToolResult.ok()
                .with("path", dir.toString())
                .with("entries", entries)
                .with("truncated", truncated);
    }

    public ToolResult stat(String path) {
        Resolution<Path> resolved = pathResolver.resolve(path);
        if (!resolved.isOk()) {
            return resolved.toFailure();
        }
        Path target = resolved.value();
        if (!Files.exists(target)) {
            return ToolResult.failure(ErrorCode.NOT_FOUND, "Path not found: " + path);
        }
        try {
            BasicFileAttributes attrs = Files.readAttributes(target, BasicFileAttributes.class);
            return ToolResult.ok()
                    .with("path", target.toString())
                    .with("type", typeOf(attrs))
                    .with("size", attrs.size())
                    .with("mtime", attrs.lastModifiedTime().toMillis() / 1000.0);
        } catch (IOException e) {
            return fromIOException(e, path);
        }
    }

    private static Map<String, Object> describe(Path entry, Path root) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("path", entry.toString());
        info.put("rel_path", entry.startsWith(root) ? root.relativize(entry).toString() : entry.getFileName().toString());
        try {
            BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class);
            info.put("type", typeOf(attrs));
            info.put("size", attrs.size());
            info.put("mtime", attrs.lastModifiedTime().toMillis() / 1000.0);
        } catch (IOException e) {
            info.put("type", "other");
            info.put("size", null);
            info.put("mtime", null);
        }
        return info;
    }

    private static String typeOf(BasicFileAttributes attrs) {
        if (attrs.isDirectory()) return "dir";
        if (attrs.isRegularFile()) return "file";
        return "other";
    }

    private static ToolResult fromIOException(IOException e, String path) {
        if (e instanceof NoSuchFileException) {
            return ToolResult.failure(ErrorCode.NOT_FOUND, "Path not found: " + path);
        }
        if (e instanceof java.nio.file.AccessDeniedException) {
            return ToolResult.failure(ErrorCode.PERMISSION_DENIED, e.getMessage());
        }
        log.warn("File operation failed for {}: {}", path, e.getMessage());
        return ToolResult.failure(ErrorCode.INTERNAL_ERROR, e.getMessage());
    }
}
