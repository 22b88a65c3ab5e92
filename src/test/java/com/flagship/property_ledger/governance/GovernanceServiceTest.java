package com.flagship.property_ledger.governance;

import com.flagship.property_ledger.LedgerFixture;
import com.flagship.property_ledger.exception.LedgerErrorCode;
import com.flagship.property_ledger.exception.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: Share-weighted voting
 *
 * Vote weight is the voter's balance when the vote is cast. These tests try to
 * double-count weight by voting twice or by moving shares between votes.
 */
class GovernanceServiceTest {

    private final List<Proposal> executed = new ArrayList<>();

    private LedgerFixture fixture;
    private GovernanceService governance;
    private long propertyId;

    @BeforeEach
    void setUp() {
        ProposalExecutionHandler recordingHandler = new ProposalExecutionHandler() {
            @Override
            public boolean supports(Proposal proposal) {
                return true;
            }

            @Override
            public void execute(Proposal proposal) {
                executed.add(proposal);
            }
        };
        fixture = new LedgerFixture(List.of(new AuditLogProposalExecutionHandler(), recordingHandler));
        governance = fixture.governance;
        propertyId = fixture.registerProperty("Harbour View", 100).getId();
        fixture.ownershipLedger.issue(propertyId, "alice", 60);
        fixture.ownershipLedger.issue(propertyId, "bob", 40);
    }

    @Test
    @DisplayName("Submitted proposals start OPEN with sequential ids")
    void testSubmit() {
        Proposal first = governance.submit(propertyId, "Replace the roof", "carol");
        Proposal second = governance.submit(propertyId, "Repaint", "alice");

        assertEquals(ProposalStatus.OPEN, first.getStatus());
        assertEquals(first.getId() + 1, second.getId());
        assertEquals(0, first.getYesVotes());
        assertEquals(List.of(first, second), governance.proposals(propertyId));
    }

    @Test
    @DisplayName("Vote weight is the balance at the time of voting")
    void testVoteWeightSnapshot() {
        long proposalId = governance.submit(propertyId, "Replace the roof", "alice").getId();

        governance.vote(proposalId, "alice", true);
        fixture.ownershipLedger.transfer(propertyId, "alice", "carol", 60);
        Proposal proposal = governance.vote(proposalId, "carol", false);

        assertEquals(60, proposal.getYesVotes());
        assertEquals(60, proposal.getNoVotes());
    }

    @Test
    @DisplayName("An identity can vote only once per proposal")
    void testDoubleVote() {
        long proposalId = governance.submit(propertyId, "Replace the roof", "alice").getId();
        governance.vote(proposalId, "alice", true);

        LedgerException exception = assertThrows(LedgerException.class,
            () -> governance.vote(proposalId, "alice", false));

        assertEquals(LedgerErrorCode.NOT_VOTABLE, exception.getCode());
        Proposal proposal = governance.findById(proposalId).orElseThrow();
        assertEquals(60, proposal.getYesVotes());
        assertEquals(0, proposal.getNoVotes());
    }

    @Test
    @DisplayName("Voters without shares and unknown proposals are not votable")
    void testNotVotable() {
        long proposalId = governance.submit(propertyId, "Replace the roof", "alice").getId();

        LedgerException noShares = assertThrows(LedgerException.class,
            () -> governance.vote(proposalId, "carol", true));
        LedgerException unknown = assertThrows(LedgerException.class,
            () -> governance.vote(999, "alice", true));

        assertEquals(LedgerErrorCode.NOT_VOTABLE, noShares.getCode());
        assertEquals(LedgerErrorCode.NOT_VOTABLE, unknown.getCode());
        assertFalse(governance.findById(proposalId).orElseThrow().hasVoted("carol"));
    }

    @Test
    @DisplayName("A majority executes the proposal and runs the handlers once")
    void testMajorityExecutes() {
        long proposalId = governance.submit(propertyId, "Replace the roof", "alice").getId();
        governance.vote(proposalId, "alice", true);
        governance.vote(proposalId, "bob", false);

        Proposal proposal = governance.execute(proposalId);

        assertEquals(ProposalStatus.EXECUTED, proposal.getStatus());
        assertEquals(1, executed.size());
        assertEquals(ProposalStatus.APPROVED, executed.get(0).getStatus());
    }

    @Test
    @DisplayName("A tie rejects the proposal without running handlers")
    void testTieRejects() {
        fixture.ownershipLedger.transfer(propertyId, "alice", "bob", 10);
        long proposalId = governance.submit(propertyId, "Sell the property", "bob").getId();
        governance.vote(proposalId, "alice", true);
        governance.vote(proposalId, "bob", false);

        Proposal proposal = governance.execute(proposalId);

        assertEquals(ProposalStatus.REJECTED, proposal.getStatus());
        assertTrue(executed.isEmpty());
    }

    @Test
    @DisplayName("A proposal without votes is rejected")
    void testNoVotesRejects() {
        long proposalId = governance.submit(propertyId, "Install solar panels", "alice").getId();

        assertEquals(ProposalStatus.REJECTED, governance.execute(proposalId).getStatus());
    }

    @Test
    @DisplayName("Closed proposals can be neither executed again nor voted on")
    void testClosedProposal() {
        long proposalId = governance.submit(propertyId, "Replace the roof", "alice").getId();
        governance.vote(proposalId, "alice", true);
        governance.execute(proposalId);

        LedgerException executeAgain = assertThrows(LedgerException.class, () -> governance.execute(proposalId));
        LedgerException lateVote = assertThrows(LedgerException.class,
            () -> governance.vote(proposalId, "bob", false));
        LedgerException unknown = assertThrows(LedgerException.class, () -> governance.execute(999));

        assertEquals(LedgerErrorCode.NOT_EXECUTABLE, executeAgain.getCode());
        assertEquals(LedgerErrorCode.NOT_VOTABLE, lateVote.getCode());
        assertEquals(LedgerErrorCode.NOT_EXECUTABLE, unknown.getCode());
        assertEquals(1, executed.size());
    }

    @Test
    @DisplayName("A failing handler leaves the proposal OPEN")
    void testFailingHandler() {
        ProposalExecutionHandler failing = new ProposalExecutionHandler() {
            @Override
            public boolean supports(Proposal proposal) {
                return true;
            }

            @Override
            public void execute(Proposal proposal) {
                throw new IllegalStateException("Contractor unavailable");
            }
        };
        LedgerFixture failingFixture = new LedgerFixture(List.of(failing));
        long id = failingFixture.registerProperty("Harbour View", 10).getId();
        failingFixture.ownershipLedger.issue(id, "alice", 10);
        long proposalId = failingFixture.governance.submit(id, "Replace the roof", "alice").getId();
        failingFixture.governance.vote(proposalId, "alice", true);

        assertThrows(IllegalStateException.class, () -> failingFixture.governance.execute(proposalId));

        assertEquals(ProposalStatus.OPEN,
            failingFixture.governance.findById(proposalId).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Open proposals are reported through a gauge")
    void testOpenProposalsGauge() {
        governance.submit(propertyId, "Replace the roof", "alice");
        long closed = governance.submit(propertyId, "Repaint", "alice").getId();
        governance.execute(closed);

        assertEquals(1.0, fixture.meterRegistry.get("governance.proposals.open").gauge().value());
    }
}
