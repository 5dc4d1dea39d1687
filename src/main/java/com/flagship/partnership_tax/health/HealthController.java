package com.flagship.partnership_tax.health;

import com.flagship.partnership_tax.config.SimulationProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 * Also reports the tax rules the engine is running with.
 */
@RestController
public class HealthController {

    private final SimulationProperties properties;

    public HealthController(SimulationProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("substantialLossThreshold", properties.getSubstantialLossThreshold());
        response.put("recognizeLosses", properties.isRecognizeLosses());
        response.put("excludedAssetTypes", properties.getExcludedAssetTypes());
        return ResponseEntity.ok(response);
    }
}
