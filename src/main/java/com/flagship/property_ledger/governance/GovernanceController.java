package com.flagship.property_ledger.governance;

import com.flagship.property_ledger.auth.CallerIdentity;
import com.flagship.property_ledger.governance.dto.ProposalResponse;
import com.flagship.property_ledger.governance.dto.SubmitProposalRequest;
import com.flagship.property_ledger.governance.dto.VoteRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for proposals and voting. Proposer and voter are the caller.
 */
@RestController
@RequestMapping("/api/proposals")
@RequiredArgsConstructor
public class GovernanceController {

    private final GovernanceService governanceService;

    @PostMapping
    public ResponseEntity<ProposalResponse> submit(
            @Valid @RequestBody SubmitProposalRequest request,
            @RequestHeader(CallerIdentity.HEADER) String caller) {
        Proposal proposal = governanceService.submit(request.getPropertyId(), request.getDescription(), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalResponse.from(proposal));
    }

    @PostMapping("/{id}/votes")
    public ProposalResponse vote(
            @PathVariable("id") long proposalId,
            @Valid @RequestBody VoteRequest request,
            @RequestHeader(CallerIdentity.HEADER) String caller) {
        return ProposalResponse.from(governanceService.vote(proposalId, caller, request.getInFavour()));
    }

    @PostMapping("/{id}/execution")
    public ProposalResponse execute(@PathVariable("id") long proposalId) {
        return ProposalResponse.from(governanceService.execute(proposalId));
    }

    @GetMapping
    public List<ProposalResponse> proposals(@RequestParam("property_id") long propertyId) {
        return governanceService.proposals(propertyId).stream().map(ProposalResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProposalResponse> get(@PathVariable("id") long proposalId) {
        return governanceService.findById(proposalId)
            .map(proposal -> ResponseEntity.ok(ProposalResponse.from(proposal)))
            .orElse(ResponseEntity.notFound().build());
    }
}
