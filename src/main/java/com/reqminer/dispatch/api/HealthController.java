package com.reqminer.dispatch.api;

import com.reqminer.core.health.HealthCheckService;
import com.reqminer.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 if no component is DOWN, 503 otherwise.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        boolean anyDown = false;
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : healthCheckService.checkAll()) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);

            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            }
        }

        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
