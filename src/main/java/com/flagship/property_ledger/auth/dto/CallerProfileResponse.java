package com.flagship.property_ledger.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_ledger.auth.Role;
import lombok.Value;

/**
 * Role and KYC flag of the calling identity.
 */
@Value
public class CallerProfileResponse {

    @JsonProperty("identity")
    String identity;

    @JsonProperty("role")
    Role role;

    @JsonProperty("kyc_verified")
    boolean kycVerified;
}
