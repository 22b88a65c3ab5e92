package com.flagship.property_ledger.property;

import com.flagship.property_ledger.auth.AuthorizationGate;
import com.flagship.property_ledger.auth.Role;
import com.flagship.property_ledger.exception.LedgerErrorCode;
import com.flagship.property_ledger.exception.LedgerException;
import com.flagship.property_ledger.ledger.LedgerStateGuard;
import com.flagship.property_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates and stores property records.
 *
 * Ids are assigned monotonically from 1 and never reused; properties are never
 * deleted. The unissued share pool of a property only shrinks through
 * {@link #withdrawAvailableShares}, which the ownership ledger calls when it issues
 * shares.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PropertyRegistry {

    private final LedgerStateGuard guard;
    private final AuthorizationGate authorizationGate;
    private final LedgerMetrics metrics;

    private final Map<Long, Property> properties = new LinkedHashMap<>();
    private long nextPropertyId = 1;

    @Value("${ledger.registry.restrict-to-managers:false}")
    private boolean restrictToManagers;

    /**
     * Registers a new property with all of its shares available.
     *
     * @param name Display name
     * @param totalShares Fixed share count, may be zero
     * @param metadata Location and description
     * @param actor Calling identity, only consulted when registration is restricted
     * @return The stored property
     * @throws LedgerException UNAUTHORIZED when registration is restricted and the actor
     *         is neither MANAGER nor ADMIN
     */
    public Property register(String name, long totalShares, PropertyMetadata metadata, String actor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name is required");
        }
        if (totalShares < 0) {
            throw new IllegalArgumentException("Total shares cannot be negative");
        }
        PropertyMetadata effectiveMetadata = metadata != null ? metadata : PropertyMetadata.empty();

        Property property = guard.atomically(() -> {
            if (restrictToManagers) {
                Role role = authorizationGate.roleOf(actor);
                if (role != Role.MANAGER && role != Role.ADMIN) {
                    metrics.recordOperation("register_property", LedgerErrorCode.UNAUTHORIZED.name());
                    throw LedgerException.unauthorized("Only managers or admins can register properties");
                }
            }
            long id = nextPropertyId++;
            Property created = Property.register(id, name, totalShares, effectiveMetadata);
            properties.put(id, created);
            return created;
        });

        metrics.recordOperation("register_property", "success");
        log.info("Property registered: propertyId={}, name={}, totalShares={}",
                property.getId(), property.getName(), property.getTotalShares());
        return property;
    }

    public Optional<Property> findById(long propertyId) {
        return guard.atomically(() -> Optional.ofNullable(properties.get(propertyId)));
    }

    /**
     * @throws LedgerException NOT_FOUND if the id was never assigned
     */
    public Property getById(long propertyId) {
        return findById(propertyId)
            .orElseThrow(() -> LedgerException.notFound("Property", propertyId));
    }

    public List<Property> findAll() {
        return guard.atomically(() -> new ArrayList<>(properties.values()));
    }

    /**
     * Display name of a property, or an empty string for an unknown id.
     */
    public String nameOf(long propertyId) {
        return findById(propertyId).map(Property::getName).orElse("");
    }

    /**
     * Replaces a property's metadata. Requires an ADMIN actor.
     *
     * @throws LedgerException UNAUTHORIZED if the actor is not ADMIN, NOT_FOUND for an unknown id
     */
    public Property updateMetadata(long propertyId, PropertyMetadata metadata, String actor) {
        if (metadata == null) {
            throw new IllegalArgumentException("Metadata is required");
        }
        Property updated = guard.atomically(() -> {
            requireAdmin(actor, "Only admin can update property metadata");
            Property updatedProperty = requireProperty(propertyId).withMetadata(metadata);
            properties.put(propertyId, updatedProperty);
            return updatedProperty;
        });
        log.info("Property metadata updated: propertyId={}, actor={}", propertyId, actor);
        return updated;
    }

    /**
     * Replaces a property's status. Requires an ADMIN actor.
     *
     * @throws LedgerException UNAUTHORIZED if the actor is not ADMIN, NOT_FOUND for an unknown id
     */
    public Property updateStatus(long propertyId, PropertyStatus status, String actor) {
        if (status == null) {
            throw new IllegalArgumentException("Status is required");
        }
        Property updated = guard.atomically(() -> {
            requireAdmin(actor, "Only admin can update property status");
            Property updatedProperty = requireProperty(propertyId).withStatus(status);
            properties.put(propertyId, updatedProperty);
            return updatedProperty;
        });
        log.info("Property status updated: propertyId={}, status={}, actor={}", propertyId, status, actor);
        return updated;
    }

    /**
     * Removes shares from a property's unissued pool.
     *
     * Only the ownership ledger calls this, inside the same atomic section that credits
     * the recipient, so the conservation law holds at every observable point.
     *
     * @throws LedgerException NOT_FOUND for an unknown id, INSUFFICIENT_SUPPLY if the
     *         pool is smaller than amount
     */
    public Property withdrawAvailableShares(long propertyId, long amount) {
        return guard.atomically(() -> {
            Property updated = requireProperty(propertyId).withdrawShares(amount);
            properties.put(propertyId, updated);
            return updated;
        });
    }

    private Property requireProperty(long propertyId) {
        Property property = properties.get(propertyId);
        if (property == null) {
            throw LedgerException.notFound("Property", propertyId);
        }
        return property;
    }

    private void requireAdmin(String actor, String message) {
        if (!authorizationGate.hasRole(actor, Role.ADMIN)) {
            throw LedgerException.unauthorized(message);
        }
    }
}
