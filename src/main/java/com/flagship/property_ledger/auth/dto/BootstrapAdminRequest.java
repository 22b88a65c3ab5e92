package com.flagship.property_ledger.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class BootstrapAdminRequest {

    @NotBlank(message = "Admin identity is required")
    @JsonProperty("admin")
    String admin;
}
