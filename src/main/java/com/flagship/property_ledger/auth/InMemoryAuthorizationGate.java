package com.flagship.property_ledger.auth;

import com.flagship.property_ledger.exception.LedgerErrorCode;
import com.flagship.property_ledger.exception.LedgerException;
import com.flagship.property_ledger.ledger.LedgerStateGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Authorization gate backed by sparse in-process maps with explicit defaults.
 *
 * Role and KYC assignments other than the one-time admin bootstrap require an ADMIN
 * actor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InMemoryAuthorizationGate implements AuthorizationGate {

    private static final Role DEFAULT_ROLE = Role.USER;
    private static final boolean DEFAULT_KYC = false;

    private final LedgerStateGuard guard;

    private final Map<String, Role> roles = new HashMap<>();
    private final Map<String, Boolean> kyc = new HashMap<>();
    private boolean bootstrapped;

    @Override
    public Role roleOf(String identity) {
        return guard.atomically(() -> roles.getOrDefault(identity, DEFAULT_ROLE));
    }

    @Override
    public boolean isKycVerified(String identity) {
        return guard.atomically(() -> kyc.getOrDefault(identity, DEFAULT_KYC));
    }

    /**
     * Grants ADMIN to the given identity. Succeeds exactly once per process.
     *
     * @throws LedgerException ALREADY_BOOTSTRAPPED on every call after the first
     */
    public void bootstrapAdmin(String identity) {
        requireIdentity(identity);
        guard.execute(() -> {
            if (bootstrapped) {
                throw new LedgerException(LedgerErrorCode.ALREADY_BOOTSTRAPPED, "Admin already bootstrapped");
            }
            roles.put(identity, Role.ADMIN);
            bootstrapped = true;
        });
        log.info("Admin bootstrapped: identity={}", identity);
    }

    public void assignRole(String actor, String identity, Role role) {
        requireIdentity(identity);
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        guard.execute(() -> {
            requireAdmin(actor, "Only admin can set roles");
            roles.put(identity, role);
        });
        log.info("Role updated: identity={}, role={}, actor={}", identity, role, actor);
    }

    public void setKycStatus(String actor, String identity, boolean verified) {
        requireIdentity(identity);
        guard.execute(() -> {
            requireAdmin(actor, "Only admin can set KYC status");
            kyc.put(identity, verified);
        });
        log.info("KYC status updated: identity={}, verified={}, actor={}", identity, verified, actor);
    }

    private void requireAdmin(String actor, String message) {
        if (roles.getOrDefault(actor, DEFAULT_ROLE) != Role.ADMIN) {
            throw LedgerException.unauthorized(message);
        }
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity is required");
        }
    }
}
