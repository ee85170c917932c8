package com.phillippitts.guardian.presentation.controller;

import com.phillippitts.guardian.domain.GuardianStatus;
import com.phillippitts.guardian.domain.SystemMetrics;
import com.phillippitts.guardian.service.guardian.GuardianControlLoop;
import com.phillippitts.guardian.service.guardian.GuardianDaemon;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the guardian. Every response is built from the latest published snapshot;
 * nothing here touches loop-owned state.
 */
@RestController
class GuardianStatusController {

    private static final Logger LOG = LogManager.getLogger(GuardianStatusController.class);

    private final GuardianControlLoop loop;
    private final ObjectProvider<GuardianDaemon> daemon;
    private final String version;

    GuardianStatusController(GuardianControlLoop loop,
                             ObjectProvider<GuardianDaemon> daemon,
                             @Value("${guardian.version:0.1.0}") String version) {
        this.loop = loop;
        this.daemon = daemon;
        this.version = version;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "inference-guardian",
                "version", version,
                "running", isDaemonRunning()
        ));
    }

    @GetMapping("/health")
    ResponseEntity<GuardianStatus> health() {
        return ResponseEntity.ok(loop.currentStatus());
    }

    @GetMapping("/api/guardian/status")
    ResponseEntity<GuardianStatus> status() {
        GuardianStatus status = loop.currentStatus();
        LOG.debug("Status requested: state={}", status.state());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/api/guardian/history")
    ResponseEntity<List<SystemMetrics>> history() {
        return ResponseEntity.ok(loop.recentMetrics());
    }

    private boolean isDaemonRunning() {
        GuardianDaemon d = daemon.getIfAvailable();
        return d != null && d.isRunning();
    }
}
