package com.flagship.property_ledger.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_ledger.governance.Proposal;
import com.flagship.property_ledger.governance.ProposalStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for governance operations.
 */
@Value
@Builder
public class ProposalResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("property_id")
    long propertyId;

    @JsonProperty("proposer")
    String proposer;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    ProposalStatus status;

    @JsonProperty("yes_votes")
    long yesVotes;

    @JsonProperty("no_votes")
    long noVotes;

    @JsonProperty("votes")
    Map<String, Boolean> votes;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ProposalResponse from(Proposal proposal) {
        return ProposalResponse.builder()
            .id(proposal.getId())
            .propertyId(proposal.getPropertyId())
            .proposer(proposal.getProposer())
            .description(proposal.getDescription())
            .status(proposal.getStatus())
            .yesVotes(proposal.getYesVotes())
            .noVotes(proposal.getNoVotes())
            .votes(proposal.getVotes())
            .createdAt(proposal.getCreatedAt())
            .updatedAt(proposal.getUpdatedAt())
            .build();
    }
}
