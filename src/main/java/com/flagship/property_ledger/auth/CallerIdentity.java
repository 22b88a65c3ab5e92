package com.flagship.property_ledger.auth;

/**
 * Request header through which the facade receives the authenticated caller identity.
 */
public final class CallerIdentity {

    public static final String HEADER = "X-Caller-Id";

    private CallerIdentity() {
        // Utility class
    }
}
