package com.flagship.property_ledger.property;

/**
 * Operational status of a registered property. Informational only: no ledger
 * operation is gated on it.
 */
public enum PropertyStatus {
    ACTIVE,
    MAINTENANCE,
    SOLD
}
