package com.flagship.classroom_ledger.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Load-balancer probe. Balances and claims are unreadable without PostgreSQL,
 * so the database is the only thing checked here; Redis and Kafka show up
 * under /actuator/health instead.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseReachable();
        String status = databaseUp ? "UP" : "DOWN";

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("database", status);
        body.put("timestamp", clock.instant().toString());

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Ledger database unreachable: {}", e.getMessage());
            return false;
        }
    }
}
