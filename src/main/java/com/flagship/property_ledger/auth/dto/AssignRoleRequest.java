package com.flagship.property_ledger.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_ledger.auth.Role;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class AssignRoleRequest {

    @NotNull(message = "Role is required")
    @JsonProperty("role")
    Role role;
}
