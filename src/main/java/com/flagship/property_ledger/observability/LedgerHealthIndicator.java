package com.flagship.property_ledger.observability;

import com.flagship.property_ledger.ledger.OwnershipLedger;
import com.flagship.property_ledger.property.PropertyRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for share accounting.
 * DOWN if any property breaks the conservation law (available + held != total).
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final PropertyRegistry propertyRegistry;
    private final OwnershipLedger ownershipLedger;

    public LedgerHealthIndicator(PropertyRegistry propertyRegistry, OwnershipLedger ownershipLedger) {
        this.propertyRegistry = propertyRegistry;
        this.ownershipLedger = ownershipLedger;
    }

    @Override
    public Health health() {
        try {
            Map<Long, Long> violations = ownershipLedger.conservationViolations();
            Health.Builder builder = violations.isEmpty() ? Health.up() : Health.down();

            return builder
                    .withDetail("properties", propertyRegistry.findAll().size())
                    .withDetail("conservationViolations", violations)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
