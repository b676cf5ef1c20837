package com.flagship.recon_ledger.consistency;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CheckSubjectEmbeddable {

    @Enumerated(EnumType.STRING)
    @Column(name = "subject_type", nullable = false, length = 20)
    private SubjectType subjectType;

    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    CheckSubjectEmbeddable(CheckSubject subject) {
        this.subjectType = subject.getType();
        this.subjectId = subject.getId();
    }

    CheckSubject toDomain() {
        return new CheckSubject(subjectType, subjectId);
    }
}
