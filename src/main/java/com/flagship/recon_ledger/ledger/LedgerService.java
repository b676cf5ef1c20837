package com.flagship.recon_ledger.ledger;

import com.flagship.recon_ledger.event.JournalEntryPostedEvent;
import com.flagship.recon_ledger.event.JournalEntryVoidedEvent;
import com.flagship.recon_ledger.exception.AlreadyProcessedException;
import com.flagship.recon_ledger.exception.LedgerValidationException;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.exception.VersionConflictException;
import com.flagship.recon_ledger.observability.CorrelationContext;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import com.flagship.recon_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ledger core: draft, validate, post, void and reconcile journal entries.
 *
 * Posting is exact. The entry must balance to the last decimal place in ledger
 * amounts; the reporting tolerance is never consulted here. The database re-checks
 * the balance when the status flips to POSTED.
 *
 * Mutations that change state take the version the caller read. A stale version
 * fails with {@link VersionConflictException} both on the explicit check and, when
 * two transactions race past it, on the optimistic-lock flush.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final String AGGREGATE_TYPE = "JournalEntry";

    private final JournalEntryRepository entryRepository;
    private final AccountRepository accountRepository;
    private final EntryValidator validator;
    private final OutboxService outboxService;
    private final ReconciliationMetrics metrics;

    /**
     * Creates a DRAFT entry. Line-level rules are enforced now; balance is enforced at post.
     */
    @Transactional
    public JournalEntry createDraft(LocalDate entryDate, String memo, SourceType sourceType, List<JournalLine> lines) {
        JournalEntry draft = JournalEntry.draft(UUID.randomUUID(), entryDate, memo, sourceType, lines);

        ValidationResult result = validator.validateLines(sourceType, draft.getLines(), loadAccounts(draft.getLines()));
        if (!result.isValid()) {
            metrics.recordValidationFailure(result.getFailure());
            throw new LedgerValidationException(result);
        }

        // Flushed right away: lines must exist in the database before any later status change
        JournalEntryEntity saved = entryRepository.saveAndFlush(JournalEntryEntity.fromDomain(draft));
        log.info("Created draft journal entry: entryId={}, lines={}, source={}",
                saved.getId(), lines.size(), sourceType);
        return saved.toDomain();
    }

    /**
     * Replaces the lines of a draft entry.
     *
     * @throws LedgerValidationException with ENTRY_NOT_EDITABLE if the entry left DRAFT
     * @throws VersionConflictException if {@code expectedVersion} is stale
     */
    @Transactional
    public JournalEntry updateDraftLines(UUID entryId, long expectedVersion, List<JournalLine> lines) {
        JournalEntryEntity entity = loadEntity(entryId);
        JournalEntry current = entity.toDomain();

        if (!current.getStatus().isEditable()) {
            metrics.recordValidationFailure(ValidationFailure.ENTRY_NOT_EDITABLE);
            throw new LedgerValidationException(ValidationResult.failed(ValidationFailure.ENTRY_NOT_EDITABLE,
                String.format("Entry %s is %s; lines can only be edited while DRAFT", entryId, current.getStatus())));
        }
        checkVersion(entity, expectedVersion);

        JournalEntry updated = current.withLines(lines);
        ValidationResult result = validator.validateLines(updated.getSourceType(), updated.getLines(),
                loadAccounts(updated.getLines()));
        if (!result.isValid()) {
            metrics.recordValidationFailure(result.getFailure());
            throw new LedgerValidationException(result);
        }

        entity.updateFromDomain(updated);
        JournalEntryEntity saved = flush(entity, expectedVersion);
        log.info("Replaced lines of draft entry: entryId={}, lines={}", entryId, lines.size());
        return saved.toDomain();
    }

    /**
     * Validates the current state of an entry without changing it.
     */
    @Transactional(readOnly = true)
    public ValidationResult validate(UUID entryId) {
        JournalEntry entry = loadEntity(entryId).toDomain();
        return validator.validate(entry, loadAccounts(entry.getLines()));
    }

    /**
     * DRAFT -> POSTED after full re-validation.
     *
     * @throws LedgerValidationException if the entry is not balanced or otherwise invalid
     * @throws AlreadyProcessedException if the entry is not a draft
     * @throws VersionConflictException if the draft changed since the caller read it
     */
    @Transactional
    public JournalEntry post(UUID entryId, long expectedVersion) {
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryId.toString());
        try {
            JournalEntryEntity entity = loadEntity(entryId);
            JournalEntry entry = entity.toDomain();

            if (entry.getStatus() != EntryStatus.DRAFT) {
                throw new AlreadyProcessedException(AGGREGATE_TYPE, entryId, entry.getStatus().name());
            }
            checkVersion(entity, expectedVersion);

            ValidationResult result = validator.validate(entry, loadAccounts(entry.getLines()));
            if (!result.isValid()) {
                metrics.recordValidationFailure(result.getFailure());
                log.warn("Posting rejected: failure={}, message={}", result.getFailure(), result.getMessage());
                throw new LedgerValidationException(result);
            }

            JournalEntry posted = entry.post();
            entity.updateFromDomain(posted);
            JournalEntryEntity saved = flush(entity, expectedVersion);

            outboxService.saveEvent(AGGREGATE_TYPE, entryId,
                    JournalEntryPostedEvent.EVENT_TYPE, JournalEntryPostedEvent.from(posted));
            metrics.recordEntryPosted(posted.getSourceType());

            log.info("Posted journal entry: debits={}, credits={}", posted.totalDebits(), posted.totalCredits());
            return saved.toDomain();
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Voids an entry.
     *
     * A DRAFT is voided in place. A POSTED entry keeps its status and gets a linked
     * reversal entry (swapped directions, same amounts) in VOID status; the returned
     * value is that reversal.
     */
    @Transactional
    public JournalEntry voidEntry(UUID entryId, String reason) {
        JournalEntryEntity entity = loadEntity(entryId);
        JournalEntry entry = entity.toDomain();

        switch (entry.getStatus()) {
            case DRAFT -> {
                JournalEntry voided = entry.voidDraft(reason);
                entity.updateFromDomain(voided);
                JournalEntryEntity saved = entryRepository.saveAndFlush(entity);
                outboxService.saveEvent(AGGREGATE_TYPE, entryId,
                        JournalEntryVoidedEvent.EVENT_TYPE, JournalEntryVoidedEvent.of(entryId, null, reason));
                metrics.recordEntryVoided("draft");
                log.info("Voided draft entry: entryId={}, reason={}", entryId, reason);
                return saved.toDomain();
            }
            case POSTED -> {
                if (entry.isReversed()) {
                    throw new AlreadyProcessedException(AGGREGATE_TYPE, entryId, "REVERSED");
                }
                JournalEntry reversal = entry.reversal(UUID.randomUUID(), reason);
                JournalEntryEntity savedReversal = entryRepository.save(JournalEntryEntity.fromDomain(reversal));

                entity.updateFromDomain(entry.markReversedBy(reversal.getId(), reason));
                entryRepository.saveAndFlush(entity);

                outboxService.saveEvent(AGGREGATE_TYPE, entryId, JournalEntryVoidedEvent.EVENT_TYPE,
                        JournalEntryVoidedEvent.of(entryId, reversal.getId(), reason));
                metrics.recordEntryVoided("reversal");
                log.info("Reversed posted entry: entryId={}, reversalId={}, reason={}",
                        entryId, reversal.getId(), reason);
                return savedReversal.toDomain();
            }
            case RECONCILED, VOID -> throw new AlreadyProcessedException(AGGREGATE_TYPE, entryId, entry.getStatus().name());
            default -> throw new IllegalStateException("Unhandled status " + entry.getStatus());
        }
    }

    /**
     * POSTED -> RECONCILED. Called by the matching engine once a match is accepted.
     * Balance is not re-checked; posting already guaranteed it.
     */
    @Transactional
    public JournalEntry reconcile(UUID entryId) {
        JournalEntryEntity entity = loadEntity(entryId);
        JournalEntry entry = entity.toDomain();

        if (entry.getStatus() != EntryStatus.POSTED) {
            throw new AlreadyProcessedException(AGGREGATE_TYPE, entryId, entry.getStatus().name());
        }
        if (entry.isReversed()) {
            throw new AlreadyProcessedException(AGGREGATE_TYPE, entryId, "REVERSED");
        }

        entity.updateFromDomain(entry.reconcile());
        JournalEntryEntity saved = entryRepository.save(entity);
        metrics.recordEntryReconciled();
        log.debug("Reconciled journal entry: entryId={}", entryId);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(UUID entryId) {
        return loadEntity(entryId).toDomain();
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> getEntries(Set<UUID> entryIds) {
        return entryRepository.findAllWithLines(entryIds).stream()
                .map(JournalEntryEntity::toDomain)
                .toList();
    }

    private JournalEntryEntity loadEntity(UUID entryId) {
        return entryRepository.findById(entryId)
                .orElseThrow(() -> new NotFoundException(AGGREGATE_TYPE, entryId));
    }

    private void checkVersion(JournalEntryEntity entity, long expectedVersion) {
        if (entity.getVersion() == null || entity.getVersion() != expectedVersion) {
            throw new VersionConflictException(AGGREGATE_TYPE, entity.getId(), expectedVersion, entity.getVersion());
        }
    }

    private JournalEntryEntity flush(JournalEntryEntity entity, long expectedVersion) {
        try {
            return entryRepository.saveAndFlush(entity);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Lost optimistic lock race on entry {}", entity.getId());
            throw new VersionConflictException(AGGREGATE_TYPE, entity.getId(), expectedVersion, null);
        }
    }

    private Map<UUID, Account> loadAccounts(List<JournalLine> lines) {
        Set<UUID> ids = lines.stream().map(JournalLine::getAccountId).collect(Collectors.toSet());
        return accountRepository.findAllById(ids).stream()
                .map(AccountEntity::toDomain)
                .collect(Collectors.toMap(Account::getId, Function.identity()));
    }
}
