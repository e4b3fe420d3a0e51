package com.swissknife.core.security;

import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.Resolution;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves user-supplied paths against the sandbox root and rejects anything
 * that lands outside it.
 * <p>
 * Symbolic links are followed component by component before the containment
 * check, and {@code ..} is applied to the already-resolved parent, so neither a
 * link nor a traversal can be used to leave the root.
 */
@Service
public class SandboxPathResolver {

    private final SandboxProperties sandboxProperties;

    public SandboxPathResolver(SandboxProperties sandboxProperties) {
        this.sandboxProperties = sandboxProperties;
    }

    /**
     * Real path of the sandbox root (links resolved when the directory exists).
     */
    public Path root() {
        Path base = sandboxProperties.getBasePath();
        try {
            return Files.exists(base) ? base.toRealPath() : base;
        } catch (IOException e) {
            return base;
        }
    }

    /**
     * Resolves a path for a file tool. Blank input is {@code invalid_path};
     * an escape from the root is {@code permission_denied}.
     */
    public Resolution<Path> resolve(String path) {
        if (path == null || path.isBlank()) {
            return Resolution.failure(ErrorCode.INVALID_PATH, "Path must be a non-empty string.");
        }
        Resolution<Path> resolved = resolveContained(path);
        if (!resolved.isOk() && resolved.error() == ErrorCode.PERMISSION_DENIED) {
            return Resolution.failure(ErrorCode.PERMISSION_DENIED,
                    "Path '" + path + "' resolves outside allowed base directory.");
        }
        return resolved;
    }

    /**
     * Joins a relative path to the root (absolute paths are used as-is),
     * resolves links and verifies the result equals or descends from the root.
     */
    public Resolution<Path> resolveContained(String path) {
        Path root = root();
        Path candidate;
        try {
            Path requested = Path.of(path);
            candidate = requested.isAbsolute() ? requested : root.resolve(requested);
        } catch (InvalidPathException e) {
            return Resolution.failure(ErrorCode.INVALID_PATH, "Could not resolve path '" + path + "': " + e.getMessage());
        }

        Path real;
        try {
            real = realPath(candidate);
        } catch (IOException e) {
            return Resolution.failure(ErrorCode.INVALID_PATH, "Could not resolve path '" + path + "': " + e.getMessage());
        }

        if (!real.startsWith(root)) {
            return Resolution.failure(ErrorCode.PERMISSION_DENIED, "Path is outside allowed base directory");
        }
        return Resolution.ok(real);
    }

    /**
     * Walks the path one name at a time, replacing each existing prefix with
     * its real path. Names past the first missing component are appended
     * verbatim after lexical {@code .}/{@code ..} handling.
     */
    static Path realPath(Path absolute) throws IOException {
        Path current = absolute.getRoot();
        for (Path name : absolute) {
            String part = name.toString();
            if (part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                Path parent = current.getParent();
                current = parent != null ? parent : current;
                continue;
            }
            current = current.resolve(part);
            if (Files.exists(current)) {
                current = current.toRealPath();
            }
        }
        return current;
    }
}
