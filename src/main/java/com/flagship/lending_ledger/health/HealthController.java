package com.flagship.lending_ledger.health;

import com.flagship.lending_ledger.ledger.AccountRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint that needs no actuator access.
 *
 * Ready means the database answers and the configured ledger accounts have
 * been resolved, i.e. postings can be accepted.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final AccountRegistry accountRegistry;
    private final Clock clock;

    public HealthController(DataSource dataSource, AccountRegistry accountRegistry, Clock clock) {
        this.dataSource = dataSource;
        this.accountRegistry = accountRegistry;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("ledgerAccounts", accountRegistry.isResolved() ? "RESOLVED" : "UNRESOLVED");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
