package com.flagship.property_ledger.auth;

/**
 * Resolves caller identities to a role and a KYC flag.
 *
 * Both lookups are total: an identity that was never assigned anything resolves to
 * {@link Role#USER} and "not verified".
 */
public interface AuthorizationGate {

    Role roleOf(String identity);

    boolean isKycVerified(String identity);

    default boolean hasRole(String identity, Role role) {
        return roleOf(identity) == role;
    }
}
