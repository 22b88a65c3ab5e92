package com.flagship.property_ledger.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class BuySharesRequest {

    @NotNull(message = "Property ID is required")
    @JsonProperty("property_id")
    Long propertyId;

    @NotBlank(message = "Seller is required")
    @JsonProperty("seller")
    String seller;

    @NotBlank(message = "Buyer is required")
    @JsonProperty("buyer")
    String buyer;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    @JsonProperty("amount")
    Long amount;
}
