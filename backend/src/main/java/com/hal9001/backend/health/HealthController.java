package com.hal9001.backend.health;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import com.hal9001.backend.global.datasource.StorageBackendHealthIndicator;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoints. All of them are reachable without a token.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "System")
public class HealthController {

    static final String ONLINE_MESSAGE = "HAL9001 API is online.";

    private final StorageBackendHealthIndicator storageHealth;
    private final Clock clock;

    public HealthController(StorageBackendHealthIndicator storageHealth, Clock clock) {
        this.storageHealth = storageHealth;
        this.clock = clock;
    }

    @Operation(summary = "Verify that the API is running")
    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "message", ONLINE_MESSAGE);
    }

    /**
     * Liveness: only checks that the process can take requests.
     */
    @GetMapping("/healthz")
    public LivenessResponse healthz() {
        return new LivenessResponse("UP", Instant.now(clock).toString());
    }

    /**
     * Readiness: borrows a real connection from the connection manager.
     */
    @GetMapping("/readyz")
    public ResponseEntity<ReadinessResponse> readyz() {
        Health health = storageHealth.health();
        Map<String, Object> details = health.getDetails();
        Object backend = details.containsKey("backend") ? details.get("backend") : details.get("configuredBackend");
        boolean fallback = Boolean.TRUE.equals(details.get("fallback"));

        ReadinessResponse body = new ReadinessResponse(
                health.getStatus().getCode(),
                backend != null ? backend.toString().toLowerCase() : null,
                fallback
        );
        HttpStatus status = Status.UP.equals(health.getStatus()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }

    public record LivenessResponse(
        String status,   // "UP"
        String timestamp // ISO-8601
    ) {}

    public record ReadinessResponse(
        String status,   // "UP" | "DOWN"
        String backend,  // "primary" | "embedded"
        boolean fallback
    ) {}
}
