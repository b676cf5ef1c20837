package com.flagship.recon_ledger.routing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "threshold_overrides")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ThresholdOverrideEntity {

    @Id
    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "auto_accept", nullable = false)
    private int autoAccept;

    @Column(name = "review_floor", nullable = false)
    private int reviewFloor;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        this.updatedAt = Instant.now();
    }

    static ThresholdOverrideEntity of(UUID accountId, Thresholds thresholds) {
        ThresholdOverrideEntity entity = new ThresholdOverrideEntity();
        entity.accountId = accountId;
        entity.apply(thresholds);
        return entity;
    }

    void apply(Thresholds thresholds) {
        this.autoAccept = thresholds.getAutoAccept();
        this.reviewFloor = thresholds.getReviewFloor();
    }

    public Thresholds toThresholds() {
        return new Thresholds(autoAccept, reviewFloor);
    }
}
