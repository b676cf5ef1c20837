package com.flagship.recon_ledger.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for journal entries.
 *
 * {@code version} backs optimistic locking: two transactions that both read the same
 * draft cannot both post it, the second flush fails.
 */
@Entity
@Table(
    name = "journal_entries",
    indexes = {
        @Index(name = "idx_journal_entries_status_date", columnList = "status, entry_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(length = 500)
    private String memo;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, updatable = false, length = 30)
    private SourceType sourceType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EntryStatus status;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "reversal_of_entry_id", updatable = false)
    private UUID reversalOfEntryId;

    @Column(name = "reversed_by_entry_id")
    private UUID reversedByEntryId;

    @Column(name = "void_reason", length = 500)
    private String voidReason;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "entry", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNo ASC")
    private List<JournalLineEntity> lines = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static JournalEntryEntity fromDomain(JournalEntry entry) {
        JournalEntryEntity entity = new JournalEntryEntity();
        entity.id = entry.getId();
        entity.entryDate = entry.getEntryDate();
        entity.memo = entry.getMemo();
        entity.sourceType = entry.getSourceType();
        entity.status = entry.getStatus();
        entity.reversalOfEntryId = entry.getReversalOfEntryId();
        entity.reversedByEntryId = entry.getReversedByEntryId();
        entity.voidReason = entry.getVoidReason();
        entity.postedAt = entry.getPostedAt();
        entity.replaceLines(entry.getLines());
        // version stays null so Hibernate treats the row as new
        return entity;
    }

    public JournalEntry toDomain() {
        return JournalEntry.builder()
            .id(id)
            .entryDate(entryDate)
            .memo(memo)
            .sourceType(sourceType)
            .status(status)
            .lines(lines.stream().map(JournalLineEntity::toDomain).toList())
            .version(version == null ? 0L : version)
            .reversalOfEntryId(reversalOfEntryId)
            .reversedByEntryId(reversedByEntryId)
            .voidReason(voidReason)
            .postedAt(postedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the mutable state of the domain object. Lines are only replaced while
     * this row is still a draft; afterwards they are frozen.
     */
    void updateFromDomain(JournalEntry entry) {
        if (this.status == EntryStatus.DRAFT && entry.getStatus() == EntryStatus.DRAFT) {
            this.entryDate = entry.getEntryDate();
            this.memo = entry.getMemo();
            replaceLines(entry.getLines());
        }
        this.status = entry.getStatus();
        this.reversedByEntryId = entry.getReversedByEntryId();
        this.voidReason = entry.getVoidReason();
        this.postedAt = entry.getPostedAt();
    }

    private void replaceLines(List<JournalLine> newLines) {
        this.lines.clear();
        int lineNo = 1;
        for (JournalLine line : newLines) {
            this.lines.add(JournalLineEntity.fromDomain(this, lineNo++, line));
        }
    }
}
