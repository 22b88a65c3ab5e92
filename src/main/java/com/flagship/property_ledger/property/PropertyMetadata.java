package com.flagship.property_ledger.property;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Free-form descriptive data of a property. Carries no invariant.
 */
@Value
public class PropertyMetadata {

    @JsonProperty("location")
    String location;

    @JsonProperty("description")
    String description;

    public static PropertyMetadata empty() {
        return new PropertyMetadata("", "");
    }
}
