package com.flagship.property_ledger.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class KycStatusRequest {

    @NotNull(message = "Verified flag is required")
    @JsonProperty("verified")
    Boolean verified;
}
