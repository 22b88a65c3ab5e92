package com.flagship.property_ledger.income.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * An income figure of one property, optionally scoped to a holder.
 */
@Value
public class IncomeAmountResponse {

    @JsonProperty("property_id")
    long propertyId;

    @JsonProperty("holder")
    String holder;

    @JsonProperty("amount")
    long amount;
}
