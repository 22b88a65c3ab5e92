package com.flagship.property_ledger.property.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_ledger.property.PropertyStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    PropertyStatus status;
}
