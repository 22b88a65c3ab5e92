package com.flagship.property_ledger.property;

import com.flagship.property_ledger.exception.LedgerException;
import lombok.Value;

/**
 * Domain model for a registered property.
 *
 * Instances are immutable; every change produces a new Property that the
 * {@link PropertyRegistry} stores in place of the old one.
 *
 * Key invariant: 0 <= sharesAvailable <= totalShares. totalShares never changes.
 */
@Value
public class Property {
    long id;
    String name;
    long totalShares;
    long sharesAvailable;
    PropertyMetadata metadata;
    PropertyStatus status;

    /**
     * Creates a new ACTIVE property with every share still unissued.
     */
    public static Property register(long id, String name, long totalShares, PropertyMetadata metadata) {
        if (totalShares < 0) {
            throw new IllegalArgumentException("Total shares cannot be negative");
        }
        return new Property(id, name, totalShares, totalShares, metadata, PropertyStatus.ACTIVE);
    }

    /**
     * Takes shares out of the unissued pool.
     *
     * @return New Property with sharesAvailable reduced by amount
     * @throws LedgerException INSUFFICIENT_SUPPLY if amount exceeds sharesAvailable
     */
    public Property withdrawShares(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Share amount cannot be negative");
        }
        if (amount > sharesAvailable) {
            throw LedgerException.insufficientSupply(id, sharesAvailable, amount);
        }
        return new Property(id, name, totalShares, sharesAvailable - amount, metadata, status);
    }

    public Property withMetadata(PropertyMetadata newMetadata) {
        return new Property(id, name, totalShares, sharesAvailable, newMetadata, status);
    }

    public Property withStatus(PropertyStatus newStatus) {
        return new Property(id, name, totalShares, sharesAvailable, metadata, newStatus);
    }

    /**
     * Shares currently held by somebody: totalShares - sharesAvailable.
     */
    public long getIssuedShares() {
        return totalShares - sharesAvailable;
    }
}
