package com.flagship.property_ledger.income;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * One line of a holder's rental income statement: unclaimed income for a property.
 */
@Value
public class RentalIncomeRecord {

    @JsonProperty("property_id")
    long propertyId;

    @JsonProperty("property_name")
    String propertyName;

    @JsonProperty("income")
    long income;
}
