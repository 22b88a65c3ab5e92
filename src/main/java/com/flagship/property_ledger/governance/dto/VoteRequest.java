package com.flagship.property_ledger.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class VoteRequest {

    @NotNull(message = "Vote choice is required")
    @JsonProperty("in_favour")
    Boolean inFavour;
}
