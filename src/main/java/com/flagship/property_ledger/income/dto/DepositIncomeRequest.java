package com.flagship.property_ledger.income.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class DepositIncomeRequest {

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount cannot be negative")
    @JsonProperty("amount")
    Long amount;
}
