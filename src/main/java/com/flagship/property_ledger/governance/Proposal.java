package com.flagship.property_ledger.governance;

import com.flagship.property_ledger.exception.LedgerErrorCode;
import com.flagship.property_ledger.exception.LedgerException;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Share-weighted governance proposal.
 *
 * Instances are immutable: votes and status transitions return a new Proposal.
 * Vote totals are sums of the voters' share balances at the time each vote was cast.
 *
 * Key invariant: every identity appears at most once in votes, and only while OPEN
 * can a vote be added.
 */
@Value
public class Proposal {
    long id;
    long propertyId;
    String proposer;
    String description;
    ProposalStatus status;
    long yesVotes;
    long noVotes;
    Map<String, Boolean> votes;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new OPEN proposal with no votes.
     */
    public static Proposal submit(long id, long propertyId, String proposer, String description) {
        Instant now = Instant.now();
        return new Proposal(id, propertyId, proposer, description, ProposalStatus.OPEN,
                0, 0, Collections.emptyMap(), now, now);
    }

    public boolean isOpen() {
        return status == ProposalStatus.OPEN;
    }

    public boolean hasVoted(String voter) {
        return votes.containsKey(voter);
    }

    /**
     * Records a vote carrying the given weight.
     *
     * @return New Proposal with the vote and the updated total
     * @throws LedgerException NOT_VOTABLE if the proposal is not OPEN or the voter already voted
     */
    public Proposal recordVote(String voter, boolean inFavour, long weight) {
        if (!isOpen()) {
            throw new LedgerException(LedgerErrorCode.NOT_VOTABLE,
                String.format("Proposal %d is %s, votes are closed", id, status));
        }
        if (hasVoted(voter)) {
            throw new LedgerException(LedgerErrorCode.NOT_VOTABLE,
                String.format("%s already voted on proposal %d", voter, id));
        }
        Map<String, Boolean> updatedVotes = new LinkedHashMap<>(votes);
        updatedVotes.put(voter, inFavour);
        return new Proposal(id, propertyId, proposer, description, status,
                inFavour ? Math.addExact(yesVotes, weight) : yesVotes,
                inFavour ? noVotes : Math.addExact(noVotes, weight),
                Collections.unmodifiableMap(updatedVotes), createdAt, Instant.now());
    }

    /**
     * Simple majority: strictly more yes than no weight. Ties do not pass.
     */
    public boolean hasMajority() {
        return yesVotes > noVotes;
    }

    /**
     * Transitions OPEN to APPROVED.
     *
     * @throws LedgerException NOT_EXECUTABLE if the proposal is not OPEN or lacks a majority
     */
    public Proposal approve() {
        if (!isOpen() || !hasMajority()) {
            throw new LedgerException(LedgerErrorCode.NOT_EXECUTABLE,
                String.format("Cannot approve proposal %d in %s status with %d yes / %d no",
                    id, status, yesVotes, noVotes));
        }
        return withStatus(ProposalStatus.APPROVED);
    }

    /**
     * Transitions APPROVED to EXECUTED.
     */
    public Proposal markExecuted() {
        if (status != ProposalStatus.APPROVED) {
            throw new IllegalStateException(
                String.format("Cannot execute proposal %d in %s status. Only APPROVED proposals can be executed.",
                    id, status));
        }
        return withStatus(ProposalStatus.EXECUTED);
    }

    /**
     * Transitions OPEN to REJECTED.
     *
     * @throws LedgerException NOT_EXECUTABLE if the proposal is not OPEN
     */
    public Proposal reject() {
        if (!isOpen()) {
            throw new LedgerException(LedgerErrorCode.NOT_EXECUTABLE,
                String.format("Cannot reject proposal %d in %s status", id, status));
        }
        return withStatus(ProposalStatus.REJECTED);
    }

    public boolean isTerminal() {
        return status == ProposalStatus.EXECUTED || status == ProposalStatus.REJECTED;
    }

    private Proposal withStatus(ProposalStatus newStatus) {
        return new Proposal(id, propertyId, proposer, description, newStatus,
                yesVotes, noVotes, votes, createdAt, Instant.now());
    }
}
