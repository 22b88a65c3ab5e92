package com.flagship.property_ledger.property;

import com.flagship.property_ledger.auth.CallerIdentity;
import com.flagship.property_ledger.property.dto.PropertyResponse;
import com.flagship.property_ledger.property.dto.RegisterPropertyRequest;
import com.flagship.property_ledger.property.dto.UpdateStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the property registry.
 */
@RestController
@RequestMapping("/api/properties")
@RequiredArgsConstructor
public class PropertyController {

    private final PropertyRegistry propertyRegistry;

    @PostMapping
    public ResponseEntity<PropertyResponse> register(
            @Valid @RequestBody RegisterPropertyRequest request,
            @RequestHeader(value = CallerIdentity.HEADER, required = false) String caller) {
        Property property = propertyRegistry.register(
            request.getName(), request.getTotalShares(), request.getMetadata(), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(PropertyResponse.from(property));
    }

    @GetMapping
    public List<PropertyResponse> all() {
        return propertyRegistry.findAll().stream().map(PropertyResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<PropertyResponse> get(@PathVariable("id") long id) {
        return propertyRegistry.findById(id)
            .map(property -> ResponseEntity.ok(PropertyResponse.from(property)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}/metadata")
    public PropertyResponse updateMetadata(
            @PathVariable("id") long id,
            @RequestBody PropertyMetadata metadata,
            @RequestHeader(CallerIdentity.HEADER) String caller) {
        return PropertyResponse.from(propertyRegistry.updateMetadata(id, metadata, caller));
    }

    @PutMapping("/{id}/status")
    public PropertyResponse updateStatus(
            @PathVariable("id") long id,
            @Valid @RequestBody UpdateStatusRequest request,
            @RequestHeader(CallerIdentity.HEADER) String caller) {
        return PropertyResponse.from(propertyRegistry.updateStatus(id, request.getStatus(), caller));
    }
}
