package com.flagship.property_ledger.auth;

/**
 * Caller role as resolved by the {@link AuthorizationGate}.
 * Identities with no explicit assignment are {@link #USER}.
 */
public enum Role {
    ADMIN,
    MANAGER,
    USER
}
