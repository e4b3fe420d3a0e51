package com.swissknife.dispatch.api;

import com.swissknife.core.fs.FileSystemTools;
import com.swissknife.core.invoke.ToolInvocationService;
import com.swissknife.core.result.ToolResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for sandboxed file operations.
 */
@RestController
@RequestMapping("/fs")
public class FileSystemController {

    private final ToolInvocationService invocation;
    private final FileSystemTools fileSystemTools;

    public FileSystemController(ToolInvocationService invocation, FileSystemTools fileSystemTools) {
        this.invocation = invocation;
        this.fileSystemTools = fileSystemTools;
    }

    @PostMapping("/read")
    public ResponseEntity<ToolResult> read(@RequestBody FsReadRequest request) {
        if (request.path() == null) {
            return ToolResponses.missingField("path");
        }
        return ResponseEntity.ok(invocation.execute("fs.read", "POST", "/fs/read", request,
                () -> fileSystemTools.read(request.path(), request.maxBytes())));
    }

    @PostMapping("/write")
    public ResponseEntity<ToolResult> write(@RequestBody FsWriteRequest request) {
        if (request.path() == null) {
            return ToolResponses.missingField("path");
        }
        if (request.content() == null) {
            return ToolResponses.missingField("content");
        }
        return ResponseEntity.ok(invocation.execute("fs.write", "POST", "/fs/write", request,
                () -> fileSystemTools.write(request.path(), request.content(), request.mode())));
    }

    @PostMapping("/list")
    public ResponseEntity<ToolResult> list(@RequestBody FsListRequest request) {
        if (request.path() == null) {
            return ToolResponses.missingField("path");
        }
        return ResponseEntity.ok(invocation.execute("fs.list", "POST", "/fs/list", request,
                () -> fileSystemTools.list(request.path(), request.recursive(), request.maxEntries())));
    }

    @PostMapping("/stat")
    public ResponseEntity<ToolResult> stat(@RequestBody FsStatRequest request) {
        if (request.path() == null) {
            return ToolResponses.missingField("path");
        }
        return ResponseEntity.ok(invocation.execute("fs.stat", "POST", "/fs/stat", request,
                () -> fileSystemTools.stat(request.path())));
    }
}
