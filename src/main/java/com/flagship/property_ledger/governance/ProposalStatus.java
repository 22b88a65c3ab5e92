package com.flagship.property_ledger.governance;

/**
 * Lifecycle of a governance proposal.
 *
 * OPEN -> APPROVED -> EXECUTED, or OPEN -> REJECTED. APPROVED only exists while
 * execution handlers run; it is never stored.
 */
public enum ProposalStatus {
    /**
     * Accepting votes. Initial state for all proposals.
     */
    OPEN,

    /**
     * Majority reached; execution handlers are running.
     */
    APPROVED,

    /**
     * Approved and executed.
     * Terminal state - no further transitions allowed.
     */
    EXECUTED,

    /**
     * Yes votes did not exceed no votes (ties reject).
     * Terminal state - no further transitions allowed.
     */
    REJECTED
}
