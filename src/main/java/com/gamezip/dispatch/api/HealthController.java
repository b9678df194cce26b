package com.gamezip.dispatch.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness probe for the main backend. Touches no other component.
 */
@RestController
public class HealthController {

    private final GatewayProperties properties;

    public HealthController(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * GET /health: always 200 while the process is serving.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "healthy");
        result.put("service", properties.getServiceName());
        result.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(result);
    }
}
