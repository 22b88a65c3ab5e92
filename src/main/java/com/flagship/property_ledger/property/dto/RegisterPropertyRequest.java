package com.flagship.property_ledger.property.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_ledger.property.PropertyMetadata;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class RegisterPropertyRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Total shares is required")
    @PositiveOrZero(message = "Total shares cannot be negative")
    @JsonProperty("total_shares")
    Long totalShares;

    @JsonProperty("metadata")
    PropertyMetadata metadata;
}
