package com.flagship.property_ledger.auth;

import com.flagship.property_ledger.auth.dto.AssignRoleRequest;
import com.flagship.property_ledger.auth.dto.BootstrapAdminRequest;
import com.flagship.property_ledger.auth.dto.CallerProfileResponse;
import com.flagship.property_ledger.auth.dto.KycStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for role and KYC administration.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final InMemoryAuthorizationGate authorizationGate;

    /**
     * One-time admin bootstrap. Needs no caller identity; fails once performed.
     */
    @PostMapping("/bootstrap")
    public ResponseEntity<CallerProfileResponse> bootstrap(@Valid @RequestBody BootstrapAdminRequest request) {
        authorizationGate.bootstrapAdmin(request.getAdmin());
        return ResponseEntity.ok(profileOf(request.getAdmin()));
    }

    @PutMapping("/roles/{identity}")
    public ResponseEntity<CallerProfileResponse> assignRole(
            @PathVariable("identity") String identity,
            @Valid @RequestBody AssignRoleRequest request,
            @RequestHeader(CallerIdentity.HEADER) String caller) {
        authorizationGate.assignRole(caller, identity, request.getRole());
        return ResponseEntity.ok(profileOf(identity));
    }

    @PutMapping("/kyc/{identity}")
    public ResponseEntity<CallerProfileResponse> setKycStatus(
            @PathVariable("identity") String identity,
            @Valid @RequestBody KycStatusRequest request,
            @RequestHeader(CallerIdentity.HEADER) String caller) {
        authorizationGate.setKycStatus(caller, identity, request.getVerified());
        return ResponseEntity.ok(profileOf(identity));
    }

    @GetMapping("/me")
    public ResponseEntity<CallerProfileResponse> me(@RequestHeader(CallerIdentity.HEADER) String caller) {
        return ResponseEntity.ok(profileOf(caller));
    }

    private CallerProfileResponse profileOf(String identity) {
        return new CallerProfileResponse(identity, authorizationGate.roleOf(identity),
                authorizationGate.isKycVerified(identity));
    }
}
