package com.flagship.property_ledger.ledger;

import com.flagship.property_ledger.exception.LedgerException;
import com.flagship.property_ledger.observability.CorrelationContext;
import com.flagship.property_ledger.observability.LedgerMetrics;
import com.flagship.property_ledger.property.Property;
import com.flagship.property_ledger.property.PropertyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Single source of truth for who owns which shares.
 *
 * This service enforces the core invariants:
 * 1. Conservation: for every property, sharesAvailable + sum(balances) == totalShares
 * 2. No negative balances: a debit larger than the balance is rejected before any mutation
 * 3. A zero balance is indistinguishable from an absent one (zero entries are removed)
 *
 * Shares enter circulation only through {@link #issue}; afterwards they move only
 * through {@link #transfer}, whose debit and credit always sum to zero.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OwnershipLedger {

    private final LedgerStateGuard guard;
    private final PropertyRegistry propertyRegistry;
    private final LedgerMetrics metrics;

    // propertyId -> (holder -> balance), holders in order of first credit
    private final Map<Long, Map<String, Long>> balances = new TreeMap<>();

    /**
     * Issues unissued shares of a property to a holder.
     *
     * @throws LedgerException NOT_FOUND for an unknown property, INSUFFICIENT_SUPPLY if
     *         amount exceeds the property's available shares
     */
    public void issue(long propertyId, String to, long amount) {
        requireHolder(to);
        requireNonNegative(amount);

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PROPERTY_ID_MDC_KEY, String.valueOf(propertyId));
        try {
            Property property = guard.atomically(() -> {
                Property updated = propertyRegistry.withdrawAvailableShares(propertyId, amount);
                credit(propertyId, to, amount);
                return updated;
            });
            metrics.recordOperation("issue", "success");
            log.info("Shares issued: to={}, amount={}, sharesAvailable={}",
                    to, amount, property.getSharesAvailable());
        } catch (LedgerException e) {
            metrics.recordOperation("issue", e.getCode().name());
            log.warn("Share issuance rejected: to={}, amount={}, reason={}", to, amount, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("issue", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.PROPERTY_ID_MDC_KEY);
        }
    }

    /**
     * Moves shares between two holders of the same property.
     *
     * A self-transfer covered by the holder's balance succeeds without changing it.
     *
     * @throws LedgerException INSUFFICIENT_BALANCE if from holds fewer than amount shares
     */
    public void transfer(long propertyId, String from, String to, long amount) {
        requireHolder(from);
        requireHolder(to);
        requireNonNegative(amount);

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PROPERTY_ID_MDC_KEY, String.valueOf(propertyId));
        try {
            guard.execute(() -> {
                long held = balanceOf(propertyId, from);
                if (held < amount) {
                    throw LedgerException.insufficientBalance(propertyId, from, held, amount);
                }
                if (from.equals(to) || amount == 0) {
                    return;
                }
                debit(propertyId, from, amount);
                credit(propertyId, to, amount);
            });
            metrics.recordOperation("transfer", "success");
            log.info("Shares transferred: from={}, to={}, amount={}", from, to, amount);
        } catch (LedgerException e) {
            metrics.recordOperation("transfer", e.getCode().name());
            log.warn("Share transfer rejected: from={}, to={}, amount={}, reason={}",
                    from, to, amount, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("transfer", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.PROPERTY_ID_MDC_KEY);
        }
    }

    /**
     * Share balance of a holder, 0 for any unknown (property, holder) pair.
     */
    public long balance(long propertyId, String holder) {
        return guard.atomically(() -> balanceOf(propertyId, holder));
    }

    /**
     * Snapshot of every positive balance of a property, in order of first credit.
     */
    public Map<String, Long> holders(long propertyId) {
        return guard.atomically(() -> {
            Map<String, Long> holders = balances.get(propertyId);
            return holders == null
                ? Collections.<String, Long>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(holders));
        });
    }

    /**
     * Ownership statement of a holder: one record per property with a positive balance,
     * ordered by property id.
     */
    public List<OwnershipRecord> statement(String holder) {
        return guard.atomically(() -> {
            List<OwnershipRecord> records = new ArrayList<>();
            balances.forEach((propertyId, holders) -> {
                Long shares = holders.get(holder);
                if (shares != null && shares > 0) {
                    records.add(new OwnershipRecord(propertyId, propertyRegistry.nameOf(propertyId), shares));
                }
            });
            return records;
        });
    }

    /**
     * Checks the conservation law for every registered property.
     *
     * @return propertyId -> accounted shares (available + held) for each property where
     *         that sum differs from totalShares; empty when the ledger is consistent
     */
    public Map<Long, Long> conservationViolations() {
        return guard.atomically(() -> {
            Map<Long, Long> violations = new TreeMap<>();
            for (Property property : propertyRegistry.findAll()) {
                long held = balances.getOrDefault(property.getId(), Collections.emptyMap())
                    .values().stream()
                    .mapToLong(Long::longValue)
                    .sum();
                long accounted = property.getSharesAvailable() + held;
                if (accounted != property.getTotalShares()) {
                    violations.put(property.getId(), accounted);
                }
            }
            return violations;
        });
    }

    private long balanceOf(long propertyId, String holder) {
        Map<String, Long> holders = balances.get(propertyId);
        if (holders == null) {
            return 0;
        }
        return holders.getOrDefault(holder, 0L);
    }

    private void credit(long propertyId, String holder, long amount) {
        if (amount == 0) {
            return;
        }
        balances.computeIfAbsent(propertyId, id -> new LinkedHashMap<>())
            .merge(holder, amount, Math::addExact);
    }

    // Caller has already checked the balance covers amount
    private void debit(long propertyId, String holder, long amount) {
        Map<String, Long> holders = balances.get(propertyId);
        long remaining = holders.get(holder) - amount;
        if (remaining == 0) {
            holders.remove(holder);
        } else {
            holders.put(holder, remaining);
        }
    }

    private static void requireHolder(String holder) {
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("Holder identity is required");
        }
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Share amount cannot be negative");
        }
    }
}
