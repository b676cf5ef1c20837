package com.flagship.recon_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Journal entry domain object.
 *
 * Transitions return new instances and reject illegal moves with
 * {@link IllegalStateException}. Nothing is ever deleted: voiding a posted entry
 * produces a separate reversal entry and links the two.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    UUID id;
    LocalDate entryDate;
    String memo;
    SourceType sourceType;
    EntryStatus status;
    List<JournalLine> lines;
    long version;
    UUID reversalOfEntryId;
    UUID reversedByEntryId;
    String voidReason;
    Instant postedAt;
    Instant createdAt;
    Instant updatedAt;

    public static JournalEntry draft(UUID id, LocalDate entryDate, String memo, SourceType sourceType,
                                     List<JournalLine> lines) {
        if (entryDate == null) {
            throw new IllegalArgumentException("Entry date is required");
        }
        if (sourceType == null) {
            throw new IllegalArgumentException("Source type is required");
        }
        Instant now = Instant.now();
        return JournalEntry.builder()
            .id(id)
            .entryDate(entryDate)
            .memo(memo)
            .sourceType(sourceType)
            .status(EntryStatus.DRAFT)
            .lines(lines == null ? List.of() : List.copyOf(lines))
            .version(0L)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Replaces all lines. Only drafts are editable.
     */
    public JournalEntry withLines(List<JournalLine> newLines) {
        if (!status.isEditable()) {
            throw new IllegalStateException(
                String.format("Cannot edit lines of entry %s in %s status. Only DRAFT entries are editable.", id, status));
        }
        return toBuilder()
            .lines(List.copyOf(newLines))
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * DRAFT -> POSTED. Balance must have been validated by the caller.
     */
    public JournalEntry post() {
        requireTransition(EntryStatus.POSTED);
        Instant now = Instant.now();
        return toBuilder()
            .status(EntryStatus.POSTED)
            .postedAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * POSTED -> RECONCILED. A reversed entry cannot be reconciled.
     */
    public JournalEntry reconcile() {
        requireTransition(EntryStatus.RECONCILED);
        if (isReversed()) {
            throw new IllegalStateException(
                String.format("Cannot reconcile entry %s: it was reversed by %s", id, reversedByEntryId));
        }
        return toBuilder()
            .status(EntryStatus.RECONCILED)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * DRAFT -> VOID.
     */
    public JournalEntry voidDraft(String reason) {
        if (status != EntryStatus.DRAFT) {
            throw new IllegalStateException(
                String.format("Cannot void entry %s in %s status directly. Only DRAFT entries can be voided in place.",
                    id, status));
        }
        return toBuilder()
            .status(EntryStatus.VOID)
            .voidReason(reason)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Builds the reversal record for a posted entry: swapped directions, identical amounts,
     * written directly in VOID status and pointing back at this entry.
     */
    public JournalEntry reversal(UUID reversalId, String reason) {
        if (status != EntryStatus.POSTED) {
            throw new IllegalStateException(
                String.format("Cannot reverse entry %s in %s status. Only POSTED entries can be reversed.", id, status));
        }
        if (isReversed()) {
            throw new IllegalStateException(
                String.format("Entry %s was already reversed by %s", id, reversedByEntryId));
        }
        Instant now = Instant.now();
        return JournalEntry.builder()
            .id(reversalId)
            .entryDate(entryDate)
            .memo("Reversal of " + id + (reason == null ? "" : ": " + reason))
            .sourceType(SourceType.SYSTEM_ADJUSTMENT)
            .status(EntryStatus.VOID)
            .lines(lines.stream().map(JournalLine::reversed).toList())
            .version(0L)
            .reversalOfEntryId(id)
            .voidReason(reason)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Links a posted entry to its reversal. The status stays POSTED for audit.
     */
    public JournalEntry markReversedBy(UUID reversalId, String reason) {
        if (status != EntryStatus.POSTED || isReversed()) {
            throw new IllegalStateException(
                String.format("Cannot mark entry %s (%s) as reversed", id, status));
        }
        return toBuilder()
            .reversedByEntryId(reversalId)
            .voidReason(reason)
            .updatedAt(Instant.now())
            .build();
    }

    public boolean isReversed() {
        return reversedByEntryId != null;
    }

    /**
     * Whether the entry contributes to balances and the accounting equation.
     */
    public boolean countsForReporting() {
        return (status == EntryStatus.POSTED || status == EntryStatus.RECONCILED) && !isReversed();
    }

    public BigDecimal totalDebits() {
        return sum(Direction.DEBIT);
    }

    public BigDecimal totalCredits() {
        return sum(Direction.CREDIT);
    }

    /**
     * Exact comparison, no tolerance.
     */
    public boolean isBalanced() {
        return totalDebits().compareTo(totalCredits()) == 0;
    }

    public boolean canTransitionTo(EntryStatus target) {
        return status.canTransitionTo(target);
    }

    private BigDecimal sum(Direction direction) {
        return lines.stream()
            .filter(line -> line.getDirection() == direction)
            .map(JournalLine::ledgerAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void requireTransition(EntryStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move entry %s from %s to %s", id, status, target));
        }
    }
}
