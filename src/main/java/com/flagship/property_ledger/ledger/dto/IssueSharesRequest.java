package com.flagship.property_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class IssueSharesRequest {

    @NotBlank(message = "Holder is required")
    @JsonProperty("holder")
    String holder;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    @JsonProperty("amount")
    Long amount;
}
