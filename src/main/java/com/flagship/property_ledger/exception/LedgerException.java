package com.flagship.property_ledger.exception;

import lombok.Getter;

/**
 * Business failure raised by the ledger core.
 *
 * Thrown only from a failure check that precedes every mutation of the operation,
 * so callers can rely on the state being unchanged.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    public LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static LedgerException notFound(String what, Object id) {
        return new LedgerException(LedgerErrorCode.NOT_FOUND, what + " not found: " + id);
    }

    public static LedgerException unauthorized(String message) {
        return new LedgerException(LedgerErrorCode.UNAUTHORIZED, message);
    }

    public static LedgerException insufficientBalance(long propertyId, String holder, long held, long requested) {
        return new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
            String.format("Holder %s owns %d shares of property %d, %d requested",
                holder, held, propertyId, requested));
    }

    public static LedgerException insufficientSupply(long propertyId, long available, long requested) {
        return new LedgerException(LedgerErrorCode.INSUFFICIENT_SUPPLY,
            String.format("Property %d has %d shares available, %d requested",
                propertyId, available, requested));
    }
}
