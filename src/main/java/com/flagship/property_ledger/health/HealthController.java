package com.flagship.property_ledger.health;

import com.flagship.property_ledger.ledger.OwnershipLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final OwnershipLedger ownershipLedger;

    public HealthController(OwnershipLedger ownershipLedger) {
        this.ownershipLedger = ownershipLedger;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean ledgerConsistent = ownershipLedger.conservationViolations().isEmpty();
        response.put("ledger", ledgerConsistent ? "UP" : "DOWN");

        if (!ledgerConsistent) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
