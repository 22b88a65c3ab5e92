package com.flagship.property_ledger.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: Counter per operation and outcome (success or error code)
 * - ledger.latency: Timer per operation
 * - income.deposited / income.claimed: Distribution summaries of income amounts
 * - income.undistributed: Distribution summary of floor-division remainders
 * - marketplace.listings.open / governance.proposals.open: Gauges
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final DistributionSummary incomeDeposited;
    private final DistributionSummary incomeClaimed;
    private final DistributionSummary incomeUndistributed;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.incomeDeposited = DistributionSummary.builder("income.deposited")
                .description("Rental income deposited per distribution")
                .register(registry);

        this.incomeClaimed = DistributionSummary.builder("income.claimed")
                .description("Rental income paid out per claim")
                .register(registry);

        this.incomeUndistributed = DistributionSummary.builder("income.undistributed")
                .description("Income left unallocated by integer division per distribution")
                .register(registry);
    }

    // ==================== Operation Counters ====================

    /**
     * Records a core operation with its outcome ("success" or the error code name).
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    /**
     * Records operation latency.
     */
    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Income ====================

    public void recordIncomeDeposited(long amount, long undistributed) {
        incomeDeposited.record(amount);
        incomeUndistributed.record(undistributed);
    }

    public void recordIncomeClaimed(long amount) {
        incomeClaimed.record(amount);
    }

    // ==================== Gauge Methods ====================

    public void registerOpenListingsGauge(Supplier<Number> supplier) {
        Gauge.builder("marketplace.listings.open", supplier)
                .description("Open marketplace listings")
                .register(registry);
    }

    public void registerOpenProposalsGauge(Supplier<Number> supplier) {
        Gauge.builder("governance.proposals.open", supplier)
                .description("Proposals still accepting votes")
                .register(registry);
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
