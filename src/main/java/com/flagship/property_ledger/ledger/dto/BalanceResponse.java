package com.flagship.property_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BalanceResponse {

    @JsonProperty("property_id")
    long propertyId;

    @JsonProperty("holder")
    String holder;

    @JsonProperty("shares")
    long shares;
}
