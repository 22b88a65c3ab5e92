package com.flagship.property_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class TransferSharesRequest {

    @NotBlank(message = "Sender is required")
    @JsonProperty("from")
    String from;

    @NotBlank(message = "Recipient is required")
    @JsonProperty("to")
    String to;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    @JsonProperty("amount")
    Long amount;
}
