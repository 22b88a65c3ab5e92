package com.flagship.property_ledger.income;

import com.flagship.property_ledger.exception.LedgerException;
import com.flagship.property_ledger.ledger.LedgerStateGuard;
import com.flagship.property_ledger.ledger.OwnershipLedger;
import com.flagship.property_ledger.observability.CorrelationContext;
import com.flagship.property_ledger.observability.LedgerMetrics;
import com.flagship.property_ledger.property.Property;
import com.flagship.property_ledger.property.PropertyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accrues rental income per property and allocates it to holders.
 *
 * Entitlements are computed once, at deposit time, from the ownership snapshot of
 * that moment: entitlement += amount * balance / totalShares with integer (floor)
 * division. Later ownership changes never adjust earlier entitlements. The remainder
 * of each deposit (at most totalShares - 1) is not allocated to anybody.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IncomeDistributionService {

    private final LedgerStateGuard guard;
    private final PropertyRegistry propertyRegistry;
    private final OwnershipLedger ownershipLedger;
    private final LedgerMetrics metrics;

    // propertyId -> cumulative deposited income
    private final Map<Long, Long> deposited = new HashMap<>();

    // propertyId -> (holder -> unclaimed income)
    private final Map<Long, Map<String, Long>> unclaimed = new TreeMap<>();

    /**
     * Deposits rental income for a property and distributes it to current holders.
     *
     * @throws LedgerException NOT_FOUND if the property is unknown or has no shares
     */
    public Distribution deposit(long propertyId, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Income amount cannot be negative");
        }

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PROPERTY_ID_MDC_KEY, String.valueOf(propertyId));
        try {
            Distribution distribution = guard.atomically(() -> distribute(propertyId, amount));
            metrics.recordOperation("deposit_income", "success");
            metrics.recordIncomeDeposited(amount, distribution.getUndistributed());
            log.info("Rental income distributed: amount={}, distributed={}, undistributed={}, recipients={}",
                    amount, distribution.getDistributed(), distribution.getUndistributed(),
                    distribution.getRecipients());
            return distribution;
        } catch (LedgerException e) {
            metrics.recordOperation("deposit_income", e.getCode().name());
            log.warn("Income deposit rejected: amount={}, reason={}", amount, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("deposit_income", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.PROPERTY_ID_MDC_KEY);
        }
    }

    /**
     * Pays out and zeroes the holder's unclaimed income for a property.
     *
     * @return The claimed amount, 0 if nothing was owed
     */
    public long claim(long propertyId, String holder) {
        long claimed = guard.atomically(() -> {
            Map<String, Long> owed = unclaimed.get(propertyId);
            if (owed == null) {
                return 0L;
            }
            Long amount = owed.remove(holder);
            return amount != null ? amount : 0L;
        });
        metrics.recordOperation("claim_income", "success");
        if (claimed > 0) {
            metrics.recordIncomeClaimed(claimed);
            log.info("Rental income claimed: propertyId={}, holder={}, amount={}", propertyId, holder, claimed);
        }
        return claimed;
    }

    public long unclaimed(long propertyId, String holder) {
        return guard.atomically(() -> unclaimed.getOrDefault(propertyId, Map.of()).getOrDefault(holder, 0L));
    }

    /**
     * Cumulative income ever deposited for a property. Informational only.
     */
    public long totalDeposited(long propertyId) {
        return guard.atomically(() -> deposited.getOrDefault(propertyId, 0L));
    }

    /**
     * Rental income statement of a holder: one record per property with unclaimed
     * income, ordered by property id.
     */
    public List<RentalIncomeRecord> statement(String holder) {
        return guard.atomically(() -> {
            List<RentalIncomeRecord> records = new ArrayList<>();
            unclaimed.forEach((propertyId, owed) -> {
                Long income = owed.get(holder);
                if (income != null && income > 0) {
                    records.add(new RentalIncomeRecord(propertyId, propertyRegistry.nameOf(propertyId), income));
                }
            });
            return records;
        });
    }

    // Runs inside the guard. Allocations are computed in full before anything is written.
    private Distribution distribute(long propertyId, long amount) {
        Property property = propertyRegistry.findById(propertyId)
            .filter(p -> p.getTotalShares() > 0)
            .orElseThrow(() -> LedgerException.notFound("Property with shares", propertyId));
        long totalShares = property.getTotalShares();

        Map<String, Long> allocations = new LinkedHashMap<>();
        long distributed = 0;
        for (Map.Entry<String, Long> holding : ownershipLedger.holders(propertyId).entrySet()) {
            long shares = holding.getValue();
            if (shares <= 0) {
                continue;
            }
            long share = Math.multiplyExact(amount, shares) / totalShares;
            allocations.put(holding.getKey(), share);
            distributed += share;
        }
        // Overflow checks, before the first write
        Map<String, Long> owed = unclaimed.getOrDefault(propertyId, Map.of());
        for (Map.Entry<String, Long> allocation : allocations.entrySet()) {
            Math.addExact(owed.getOrDefault(allocation.getKey(), 0L), allocation.getValue());
        }
        long newTotal = Math.addExact(deposited.getOrDefault(propertyId, 0L), amount);

        deposited.put(propertyId, newTotal);
        Map<String, Long> propertyOwed = unclaimed.computeIfAbsent(propertyId, id -> new LinkedHashMap<>());
        allocations.forEach((holder, share) -> {
            if (share > 0) {
                propertyOwed.merge(holder, share, Long::sum);
            }
        });

        return new Distribution(propertyId, amount, distributed, amount - distributed, allocations.size());
    }
}
