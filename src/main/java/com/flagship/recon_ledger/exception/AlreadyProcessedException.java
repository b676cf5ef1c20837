package com.flagship.recon_ledger.exception;

import java.util.UUID;

/**
 * The target is no longer in an actionable status (e.g. accepting an already rejected match).
 * Distinct from {@link VersionConflictException}: re-fetching will not help.
 */
public class AlreadyProcessedException extends RuntimeException {

    private final String entityType;
    private final UUID entityId;
    private final String status;

    public AlreadyProcessedException(String entityType, UUID entityId, String status) {
        super(String.format("%s %s is already %s", entityType, entityId, status));
        this.entityType = entityType;
        this.entityId = entityId;
        this.status = status;
    }

    public String getEntityType() {
        return entityType;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public String getStatus() {
        return status;
    }
}
