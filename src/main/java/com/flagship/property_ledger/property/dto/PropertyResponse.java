package com.flagship.property_ledger.property.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_ledger.property.Property;
import com.flagship.property_ledger.property.PropertyMetadata;
import com.flagship.property_ledger.property.PropertyStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Response DTO for property operations.
 */
@Value
@Builder
public class PropertyResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("name")
    String name;

    @JsonProperty("total_shares")
    long totalShares;

    @JsonProperty("shares_available")
    long sharesAvailable;

    @JsonProperty("metadata")
    PropertyMetadata metadata;

    @JsonProperty("status")
    PropertyStatus status;

    public static PropertyResponse from(Property property) {
        return PropertyResponse.builder()
            .id(property.getId())
            .name(property.getName())
            .totalShares(property.getTotalShares())
            .sharesAvailable(property.getSharesAvailable())
            .metadata(property.getMetadata())
            .status(property.getStatus())
            .build();
    }
}
