package com.swissknife.dispatch.api;

import com.swissknife.core.exec.ShellExecutor;
import com.swissknife.core.invoke.ToolInvocationService;
import com.swissknife.core.result.ToolResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for synchronous command execution.
 */
@RestController
public class ShellController {

    private final ToolInvocationService invocation;
    private final ShellExecutor shellExecutor;

    public ShellController(ToolInvocationService invocation, ShellExecutor shellExecutor) {
        this.invocation = invocation;
        this.shellExecutor = shellExecutor;
    }

    @PostMapping("/shell/exec")
    public ResponseEntity<ToolResult> exec(@RequestBody ShellExecRequest request) {
        if (request.cmd() == null) {
            return ToolResponses.missingField("cmd");
        }
        return ResponseEntity.ok(invocation.execute(ShellExecutor.TOOL_EXEC, "POST", "/shell/exec", request,
                () -> shellExecutor.exec(request.cmd(), request.cwd(), request.env(), request.timeoutS())));
    }
}
