package com.swissknife.dispatch.api;

import com.swissknife.core.invoke.ToolInvocationService;
import com.swissknife.core.process.ProcessSupervisor;
import com.swissknife.core.result.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for server-supervised background processes.
 */
@RestController
@RequestMapping("/process")
public class ProcessController {

    private static final Logger log = LoggerFactory.getLogger(ProcessController.class);

    private final ToolInvocationService invocation;
    private final ProcessSupervisor supervisor;

    public ProcessController(ToolInvocationService invocation, ProcessSupervisor supervisor) {
        this.invocation = invocation;
        this.supervisor = supervisor;
    }

    /**
     * POST /process/start. Returns immediately with the pid; output goes to
     * log files under the supervisor's work directory when captured.
     */
    @PostMapping("/start")
    public ResponseEntity<ToolResult> start(@RequestBody ProcessStartRequest request) {
        if (request.cmd() == null) {
            return ToolResponses.missingField("cmd");
        }
        log.debug("Starting process (capture={})", request.captureOutput());
        return ResponseEntity.ok(invocation.execute(ProcessSupervisor.TOOL_START, "POST", "/process/start", request,
                () -> supervisor.start(request.cmd(), request.cwd(), request.env(), request.captureOutput())));
    }

    @PostMapping("/status")
    public ResponseEntity<ToolResult> status(@RequestBody ProcessStatusRequest request) {
        if (request.pid() == null) {
            return ToolResponses.missingField("pid");
        }
        return ResponseEntity.ok(invocation.execute("process.status", "POST", "/process/status", request,
                () -> supervisor.status(request.pid())));
    }

    @PostMapping("/kill")
    public ResponseEntity<ToolResult> kill(@RequestBody ProcessKillRequest request) {
        if (request.pid() == null) {
            return ToolResponses.missingField("pid");
        }
        return ResponseEntity.ok(invocation.execute("process.kill", "POST", "/process/kill", request,
                () -> supervisor.kill(request.pid(), request.force(), request.timeoutS())));
    }

    @PostMapping("/read")
    public ResponseEntity<ToolResult> read(@RequestBody ProcessReadRequest request) {
        if (request.pid() == null) {
            return ToolResponses.missingField("pid");
        }
        return ResponseEntity.ok(invocation.execute("process.read", "POST", "/process/read", request,
                () -> supervisor.read(request.pid(), request.stream(), request.maxBytes(), request.tail())));
    }

    /** POST /process/list. Any body is ignored. */
    @PostMapping("/list")
    public ToolResult list() {
        return invocation.execute("process.list", "POST", "/process/list", Map.of(), supervisor::list);
    }
}
