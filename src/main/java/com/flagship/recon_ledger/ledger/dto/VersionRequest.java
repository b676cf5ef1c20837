package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Body of version-guarded commands (post an entry).
 */
@Value
public class VersionRequest {

    @NotNull(message = "Version is required")
    @JsonProperty("version")
    Long version;

    @JsonCreator
    public VersionRequest(@JsonProperty("version") Long version) {
        this.version = version;
    }
}
