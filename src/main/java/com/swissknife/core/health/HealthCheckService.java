package com.swissknife.core.health;

import com.swissknife.core.process.ProcessSupervisor;
import com.swissknife.core.security.SandboxPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxPathResolver pathResolver;
    private final ProcessSupervisor supervisor;

    public HealthCheckService(
            SandboxPathResolver pathResolver,
            @Autowired(required = false) ProcessSupervisor supervisor) {
        this.pathResolver = pathResolver;
        this.supervisor = supervisor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSandbox());
        results.add(checkSupervisor());
        results.add(checkWorkDir());
        return results;
    }

    public boolean allUp(List<HealthStatus> statuses) {
        return statuses.stream().allMatch(HealthStatus::isUp);
    }

    private HealthStatus checkSandbox() {
        Path root = pathResolver.root();
        if (!Files.isDirectory(root)) {
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    "Sandbox root is not a directory", Map.of("root", root.toString()));
        }
        if (!Files.isWritable(root)) {
            return new HealthStatus("sandbox", HealthStatus.Status.DEGRADED,
                    "Sandbox root is read-only", Map.of("root", root.toString()));
        }
        return new HealthStatus("sandbox", HealthStatus.Status.UP,
                "Sandbox root available", Map.of("root", root.toString()));
    }

    private HealthStatus checkSupervisor() {
        if (supervisor == null) {
            return new HealthStatus("supervisor", HealthStatus.Status.DOWN,
                    "Process supervisor not available", Map.of());
        }
        return new HealthStatus("supervisor", HealthStatus.Status.UP,
                "Tracking " + supervisor.trackedCount() + " process(es)",
                Map.of("tracked", String.valueOf(supervisor.trackedCount())));
    }

    private HealthStatus checkWorkDir() {
        if (supervisor == null) {
            return new HealthStatus("work_dir", HealthStatus.Status.DOWN,
                    "No process work directory", Map.of());
        }
        Path workDir = supervisor.workDir();
        try {
            Files.createDirectories(workDir);
            if (Files.isWritable(workDir)) {
                return new HealthStatus("work_dir", HealthStatus.Status.UP,
                        "Process log directory writable", Map.of("path", workDir.toString()));
            }
            return new HealthStatus("work_dir", HealthStatus.Status.DEGRADED,
                    "Process log directory is read-only", Map.of("path", workDir.toString()));
        } catch (Exception e) {
            log.warn("Work dir health check failed: {}", e.getMessage());
            return new HealthStatus("work_dir", HealthStatus.Status.DOWN,
                    "Work dir error: " + e.getMessage(), Map.of("path", workDir.toString()));
        }
    }
}
