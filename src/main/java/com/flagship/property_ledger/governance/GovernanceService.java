package com.flagship.property_ledger.governance;

import com.flagship.property_ledger.exception.LedgerErrorCode;
import com.flagship.property_ledger.exception.LedgerException;
import com.flagship.property_ledger.ledger.LedgerStateGuard;
import com.flagship.property_ledger.ledger.OwnershipLedger;
import com.flagship.property_ledger.observability.CorrelationContext;
import com.flagship.property_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Share-weighted proposals and voting.
 *
 * A vote weighs the voter's share balance at the moment it is cast; the weight is
 * never re-evaluated. Each identity votes at most once per proposal. Execution applies
 * simple majority (ties reject) and runs the registered
 * {@link ProposalExecutionHandler}s for approved proposals.
 */
@Service
@Slf4j
public class GovernanceService {

    private final LedgerStateGuard guard;
    private final OwnershipLedger ownershipLedger;
    private final List<ProposalExecutionHandler> executionHandlers;
    private final LedgerMetrics metrics;

    private final Map<Long, Proposal> proposals = new LinkedHashMap<>();
    private long nextProposalId = 1;

    public GovernanceService(LedgerStateGuard guard,
                             OwnershipLedger ownershipLedger,
                             List<ProposalExecutionHandler> executionHandlers,
                             LedgerMetrics metrics) {
        this.guard = guard;
        this.ownershipLedger = ownershipLedger;
        this.executionHandlers = List.copyOf(executionHandlers);
        this.metrics = metrics;
        metrics.registerOpenProposalsGauge(() -> guard.atomically(() ->
                proposals.values().stream().filter(Proposal::isOpen).count()));
    }

    /**
     * Opens a new proposal. Submitting needs no shares; only voting does.
     */
    public Proposal submit(long propertyId, String description, String proposer) {
        if (proposer == null || proposer.isBlank()) {
            throw new IllegalArgumentException("Proposer identity is required");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Proposal description is required");
        }

        Proposal proposal = guard.atomically(() -> {
            long id = nextProposalId++;
            Proposal created = Proposal.submit(id, propertyId, proposer, description);
            proposals.put(id, created);
            return created;
        });
        metrics.recordOperation("submit_proposal", "success");
        log.info("Proposal submitted: proposalId={}, propertyId={}, proposer={}",
                proposal.getId(), propertyId, proposer);
        return proposal;
    }

    /**
     * Casts a share-weighted vote.
     *
     * @throws LedgerException NOT_VOTABLE if the proposal does not exist, is not OPEN,
     *         the voter already voted, or the voter holds no shares of the property
     */
    public Proposal vote(long proposalId, String voter, boolean inFavour) {
        if (voter == null || voter.isBlank()) {
            throw new IllegalArgumentException("Voter identity is required");
        }

        MDC.put(CorrelationContext.PROPOSAL_ID_MDC_KEY, String.valueOf(proposalId));
        try {
            Proposal updated = guard.atomically(() -> {
                Proposal proposal = proposals.get(proposalId);
                if (proposal == null) {
                    throw new LedgerException(LedgerErrorCode.NOT_VOTABLE, "Proposal not found: " + proposalId);
                }
                long weight = ownershipLedger.balance(proposal.getPropertyId(), voter);
                if (proposal.isOpen() && !proposal.hasVoted(voter) && weight == 0) {
                    // closed and duplicate votes are reported by recordVote
                    throw new LedgerException(LedgerErrorCode.NOT_VOTABLE,
                        String.format("%s holds no shares of property %d", voter, proposal.getPropertyId()));
                }
                Proposal voted = proposal.recordVote(voter, inFavour, weight);
                proposals.put(proposalId, voted);
                return voted;
            });
            metrics.recordOperation("vote", "success");
            log.info("Vote recorded: voter={}, inFavour={}, yesVotes={}, noVotes={}",
                    voter, inFavour, updated.getYesVotes(), updated.getNoVotes());
            return updated;
        } catch (LedgerException e) {
            metrics.recordOperation("vote", e.getCode().name());
            log.warn("Vote rejected: voter={}, reason={}", voter, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PROPOSAL_ID_MDC_KEY);
        }
    }

    /**
     * Closes an OPEN proposal: EXECUTED when yes votes exceed no votes, REJECTED otherwise.
     *
     * @return The proposal in its terminal state
     * @throws LedgerException NOT_EXECUTABLE if the proposal does not exist or is not OPEN
     */
    public Proposal execute(long proposalId) {
        MDC.put(CorrelationContext.PROPOSAL_ID_MDC_KEY, String.valueOf(proposalId));
        try {
            Proposal closed = guard.atomically(() -> {
                Proposal proposal = proposals.get(proposalId);
                if (proposal == null || !proposal.isOpen()) {
                    throw new LedgerException(LedgerErrorCode.NOT_EXECUTABLE,
                        "Proposal not found or not open: " + proposalId);
                }
                Proposal result;
                if (proposal.hasMajority()) {
                    Proposal approved = proposal.approve();
                    for (ProposalExecutionHandler handler : executionHandlers) {
                        if (handler.supports(approved)) {
                            handler.execute(approved);
                        }
                    }
                    result = approved.markExecuted();
                } else {
                    result = proposal.reject();
                }
                proposals.put(proposalId, result);
                return result;
            });
            metrics.recordOperation("execute_proposal", closed.getStatus().name());
            log.info("Proposal closed: status={}, yesVotes={}, noVotes={}",
                    closed.getStatus(), closed.getYesVotes(), closed.getNoVotes());
            return closed;
        } catch (LedgerException e) {
            metrics.recordOperation("execute_proposal", e.getCode().name());
            log.warn("Proposal execution rejected: reason={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PROPOSAL_ID_MDC_KEY);
        }
    }

    public Optional<Proposal> findById(long proposalId) {
        return guard.atomically(() -> Optional.ofNullable(proposals.get(proposalId)));
    }

    /**
     * Proposals of a property ordered by id.
     */
    public List<Proposal> proposals(long propertyId) {
        return guard.atomically(() -> {
            List<Proposal> result = new ArrayList<>();
            for (Proposal proposal : proposals.values()) {
                if (proposal.getPropertyId() == propertyId) {
                    result.add(proposal);
                }
            }
            return result;
        });
    }
}
