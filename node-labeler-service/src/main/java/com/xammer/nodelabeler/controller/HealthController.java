package com.xammer.nodelabeler.controller;

import com.xammer.nodelabeler.dto.HealthDto;
import com.xammer.nodelabeler.service.ControllerDiagnostics;
import com.xammer.nodelabeler.service.NodeReconciler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes.
 */
@RestController
public class HealthController {

    private final ControllerDiagnostics diagnostics;
    private final NodeReconciler reconciler;

    public HealthController(ControllerDiagnostics diagnostics, NodeReconciler reconciler) {
        this.diagnostics = diagnostics;
        this.reconciler = reconciler;
    }

    /** Unhealthy while the node watch has reported errors within the configured window. */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        if (diagnostics.isHealthy()) {
            return ResponseEntity.ok("OK");
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Unhealthy");
    }

    @GetMapping("/ready")
    public ResponseEntity<String> ready() {
        if (diagnostics.isReady()) {
            return ResponseEntity.ok("OK");
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("Not ready");
    }

    @GetMapping("/api/health")
    public HealthDto details() {
        int errors = diagnostics.recentWatchErrors();
        return new HealthDto(
                errors == 0 ? "OK" : "Unhealthy",
                diagnostics.isReady(),
                errors,
                diagnostics.getLastEvent(),
                reconciler.status().size());
    }
}
