package com.flagship.property_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * One line of a holder's ownership statement.
 */
@Value
public class OwnershipRecord {

    @JsonProperty("property_id")
    long propertyId;

    @JsonProperty("property_name")
    String propertyName;

    @JsonProperty("shares")
    long shares;
}
