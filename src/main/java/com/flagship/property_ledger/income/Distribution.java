package com.flagship.property_ledger.income;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Outcome of one rental income deposit.
 *
 * undistributed is the floor-division remainder (deposited - distributed); it is
 * neither allocated nor carried into later deposits.
 */
@Value
public class Distribution {

    @JsonProperty("property_id")
    long propertyId;

    @JsonProperty("deposited")
    long deposited;

    @JsonProperty("distributed")
    long distributed;

    @JsonProperty("undistributed")
    long undistributed;

    @JsonProperty("recipients")
    int recipients;
}
