package com.studyprep.api.controller;

import com.studyprep.data.vector.QuestionVectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Public health endpoints for load balancers and monitoring.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final String SERVICE_NAME = "studyprep-questions";

    private final DataSource dataSource;
    private final QuestionVectorStore vectorStore;

    private static final Instant startTime = Instant.now();

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", SERVICE_NAME);
        return ResponseEntity.ok(response);
    }

    /**
     * Database connectivity plus vector capability. A missing vector capability
     * degrades the service (search returns nothing) but does not take it down.
     */
    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", SERVICE_NAME);
        response.put("uptimeSeconds", Instant.now().getEpochSecond() - startTime.getEpochSecond());

        Map<String, Object> dbHealth = checkDatabaseHealth();
        response.put("database", dbHealth);

        Map<String, Object> vectorHealth = checkVectorHealth();
        response.put("vector", vectorHealth);

        if (!"UP".equals(dbHealth.get("status")) || !"UP".equals(vectorHealth.get("status"))) {
            response.put("status", "DEGRADED");
        }

        return ResponseEntity.ok(response);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("pong");
    }

    private Map<String, Object> checkDatabaseHealth() {
        Map<String, Object> dbHealth = new HashMap<>();
        long start = System.currentTimeMillis();

        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(5);
            dbHealth.put("status", valid ? "UP" : "DOWN");
            dbHealth.put("responseTimeMs", System.currentTimeMillis() - start);
            dbHealth.put("database", connection.getMetaData().getDatabaseProductName());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            dbHealth.put("status", "DOWN");
            dbHealth.put("error", e.getMessage());
            dbHealth.put("responseTimeMs", System.currentTimeMillis() - start);
        }

        return dbHealth;
    }

    private Map<String, Object> checkVectorHealth() {
        Map<String, Object> vectorHealth = new HashMap<>();
        try {
            boolean available = vectorStore.isVectorCapabilityAvailable();
            vectorHealth.put("status", available ? "UP" : "UNAVAILABLE");
            vectorHealth.put("dimensions", vectorStore.getDimensions());
            if (available) {
                vectorHealth.put("storedVectors", vectorStore.countStoredVectors());
            }
        } catch (Exception e) {
            log.warn("Vector health check failed: {}", e.getMessage());
            vectorHealth.put("status", "DOWN");
            vectorHealth.put("error", e.getMessage());
        }
        return vectorHealth;
    }
}
