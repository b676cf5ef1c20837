package com.flagship.recon_ledger.consistency.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.consistency.CheckStatus;
import com.flagship.recon_ledger.consistency.CheckType;
import com.flagship.recon_ledger.consistency.ConsistencyCheck;
import com.flagship.recon_ledger.consistency.ResolutionAction;
import com.flagship.recon_ledger.consistency.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class ConsistencyCheckResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("check_type")
    CheckType checkType;

    @JsonProperty("severity")
    Severity severity;

    @JsonProperty("status")
    CheckStatus status;

    @JsonProperty("subjects")
    List<Subject> subjects;

    @JsonProperty("details")
    Map<String, Object> details;

    @JsonProperty("resolution_action")
    ResolutionAction resolutionAction;

    @JsonProperty("resolution_note")
    String resolutionNote;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    @Value
    public static class Subject {
        @JsonProperty("type")
        String type;

        @JsonProperty("id")
        UUID id;
    }

    public static ConsistencyCheckResponse from(ConsistencyCheck check) {
        return ConsistencyCheckResponse.builder()
            .id(check.getId())
            .checkType(check.getType())
            .severity(check.getSeverity())
            .status(check.getStatus())
            .subjects(check.getSubjects().stream().map(s -> new Subject(s.getType().name(), s.getId())).toList())
            .details(check.getDetails())
            .resolutionAction(check.getResolutionAction())
            .resolutionNote(check.getResolutionNote())
            .createdAt(check.getCreatedAt())
            .resolvedAt(check.getResolvedAt())
            .build();
    }
}
