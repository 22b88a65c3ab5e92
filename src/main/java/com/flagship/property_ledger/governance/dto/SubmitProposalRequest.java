package com.flagship.property_ledger.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class SubmitProposalRequest {

    @NotNull(message = "Property ID is required")
    @JsonProperty("property_id")
    Long propertyId;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;
}
