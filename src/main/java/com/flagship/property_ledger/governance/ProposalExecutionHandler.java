package com.flagship.property_ledger.governance;

/**
 * Extension point invoked when a proposal is approved.
 *
 * Handlers run inside the same atomic section as the status change, before EXECUTED
 * is committed. A handler that throws aborts the execution and the proposal stays
 * OPEN.
 */
public interface ProposalExecutionHandler {

    /**
     * Whether this handler acts on the given approved proposal.
     */
    boolean supports(Proposal proposal);

    void execute(Proposal proposal);
}
