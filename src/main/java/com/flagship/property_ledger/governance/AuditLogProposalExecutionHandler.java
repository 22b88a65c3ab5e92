package com.flagship.property_ledger.governance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default execution handler: records every approved proposal in the audit log.
 * Execution has no effect on the ledger.
 */
@Component
@Slf4j
public class AuditLogProposalExecutionHandler implements ProposalExecutionHandler {

    @Override
    public boolean supports(Proposal proposal) {
        return true;
    }

    @Override
    public void execute(Proposal proposal) {
        log.info("Proposal executed: proposalId={}, propertyId={}, yesVotes={}, noVotes={}, description={}",
                proposal.getId(), proposal.getPropertyId(), proposal.getYesVotes(),
                proposal.getNoVotes(), proposal.getDescription());
    }
}
