package com.flagship.recon_ledger.exception;

import java.util.UUID;

/**
 * The caller acted on a stale version of an entry or match and must re-fetch.
 */
public class VersionConflictException extends RuntimeException {

    private final String entityType;
    private final UUID entityId;
    private final long expectedVersion;
    private final Long actualVersion;

    public VersionConflictException(String entityType, UUID entityId, long expectedVersion, Long actualVersion) {
        super(String.format("%s %s was modified concurrently: expected version %d, current version %s",
                entityType, entityId, expectedVersion, actualVersion == null ? "unknown" : actualVersion));
        this.entityType = entityType;
        this.entityId = entityId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getEntityType() {
        return entityType;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public Long getActualVersion() {
        return actualVersion;
    }
}
