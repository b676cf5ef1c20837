package com.flagship.recon_ledger.consistency;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "consistency_checks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ConsistencyCheckEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "check_type", nullable = false, updatable = false, length = 40)
    private CheckType checkType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CheckStatus status;

    @Column(nullable = false, updatable = false, unique = true, length = 600)
    private String fingerprint;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "consistency_check_subjects", joinColumns = @JoinColumn(name = "check_id"))
    private Set<CheckSubjectEmbeddable> subjects = new LinkedHashSet<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> details;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_action", length = 20)
    private ResolutionAction resolutionAction;

    @Column(name = "resolution_note", length = 1000)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    static ConsistencyCheckEntity fromDomain(ConsistencyCheck check) {
        ConsistencyCheckEntity entity = new ConsistencyCheckEntity();
        entity.id = check.getId();
        entity.checkType = check.getType();
        entity.severity = check.getSeverity();
        entity.status = check.getStatus();
        entity.fingerprint = check.getFingerprint();
        check.getSubjects().forEach(s -> entity.subjects.add(new CheckSubjectEmbeddable(s)));
        entity.details = check.getDetails();
        entity.resolutionAction = check.getResolutionAction();
        entity.resolutionNote = check.getResolutionNote();
        entity.createdAt = check.getCreatedAt();
        entity.resolvedAt = check.getResolvedAt();
        return entity;
    }

    public ConsistencyCheck toDomain() {
        return ConsistencyCheck.builder()
            .id(id)
            .type(checkType)
            .severity(severity)
            .status(status)
            .fingerprint(fingerprint)
            .subjects(subjects.stream().map(CheckSubjectEmbeddable::toDomain).sorted().toList())
            .details(details)
            .resolutionAction(resolutionAction)
            .resolutionNote(resolutionNote)
            .createdAt(createdAt)
            .resolvedAt(resolvedAt)
            .build();
    }

    void updateFromDomain(ConsistencyCheck check) {
        this.severity = check.getSeverity();
        this.status = check.getStatus();
        this.resolutionAction = check.getResolutionAction();
        this.resolutionNote = check.getResolutionNote();
        this.resolvedAt = check.getResolvedAt();
    }
}
