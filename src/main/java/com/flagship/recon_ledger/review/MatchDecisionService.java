package com.flagship.recon_ledger.review;

import com.flagship.recon_ledger.consistency.ConsistencyCheck;
import com.flagship.recon_ledger.consistency.ConsistencyChecker;
import com.flagship.recon_ledger.event.MatchResolvedEvent;
import com.flagship.recon_ledger.exception.AlreadyProcessedException;
import com.flagship.recon_ledger.exception.ConsistencyBlockException;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.exception.VersionConflictException;
import com.flagship.recon_ledger.ledger.EntryStatus;
import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.ledger.LedgerService;
import com.flagship.recon_ledger.matching.MatchPersistenceService;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import com.flagship.recon_ledger.observability.CorrelationContext;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import com.flagship.recon_ledger.outbox.OutboxService;
import com.flagship.recon_ledger.statement.BankTransactionEntity;
import com.flagship.recon_ledger.statement.BankTransactionRepository;
import com.flagship.recon_ledger.statement.BankTransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Human accept/reject of pending matches.
 *
 * Both take the match version the reviewer saw. A different stored version, or a
 * concurrent writer detected at flush, is a {@link VersionConflictException}; a match that
 * is no longer PENDING_REVIEW is an {@link AlreadyProcessedException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchDecisionService {

    static final String AGGREGATE_TYPE = "ReconciliationMatch";

    private final MatchPersistenceService matches;
    private final BankTransactionRepository transactionRepository;
    private final LedgerService ledgerService;
    private final ConsistencyChecker consistencyChecker;
    private final OutboxService outboxService;
    private final ReconciliationMetrics metrics;

    /**
     * PENDING_REVIEW -> ACCEPTED. Refused while blocking consistency checks reference the
     * match. Draft entries are posted, every entry is reconciled, the transaction becomes MATCHED.
     */
    @Transactional
    public ReconciliationMatch accept(UUID matchId, long expectedVersion, String note) {
        MDC.put(CorrelationContext.MATCH_ID_MDC_KEY, matchId.toString());
        try {
            ReconciliationMatch current = loadPending(matchId, expectedVersion);
            requireUnblocked(current);

            ReconciliationMatch accepted = matches.update(current.accept(note), expectedVersion);

            settleEntries(accepted.getEntryIds());
            updateTransaction(accepted.getBankTransactionId(), BankTransactionStatus.MATCHED);

            outboxService.saveEvent(AGGREGATE_TYPE, matchId, MatchResolvedEvent.EVENT_TYPE,
                MatchResolvedEvent.from(accepted));
            metrics.recordMatchResolved(MatchStatus.ACCEPTED, "review");
            log.info("Accepted match: matchId={}, txnId={}, entries={}",
                matchId, accepted.getBankTransactionId(), accepted.getEntryIds());
            return accepted;
        } finally {
            MDC.remove(CorrelationContext.MATCH_ID_MDC_KEY);
        }
    }

    /**
     * PENDING_REVIEW -> REJECTED. The entry set is never proposed for this transaction again.
     * Refused while blocking consistency checks reference the match, same as accept.
     */
    @Transactional
    public ReconciliationMatch reject(UUID matchId, long expectedVersion, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Rejection reason is required");
        }
        MDC.put(CorrelationContext.MATCH_ID_MDC_KEY, matchId.toString());
        try {
            ReconciliationMatch current = loadPending(matchId, expectedVersion);
            requireUnblocked(current);

            ReconciliationMatch rejected = matches.update(current.reject(reason), expectedVersion);

            boolean otherActive = matches.findForTransaction(rejected.getBankTransactionId()).stream()
                .filter(m -> !m.getId().equals(matchId))
                .anyMatch(m -> m.getStatus() == MatchStatus.PENDING_REVIEW || m.getStatus().isConfirmed());
            if (!otherActive) {
                updateTransaction(rejected.getBankTransactionId(), BankTransactionStatus.UNMATCHED);
            }

            outboxService.saveEvent(AGGREGATE_TYPE, matchId, MatchResolvedEvent.EVENT_TYPE,
                MatchResolvedEvent.from(rejected));
            metrics.recordMatchResolved(MatchStatus.REJECTED, "review");
            log.info("Rejected match: matchId={}, txnId={}, reason={}", matchId, rejected.getBankTransactionId(), reason);
            return rejected;
        } finally {
            MDC.remove(CorrelationContext.MATCH_ID_MDC_KEY);
        }
    }

    /**
     * Posts any draft among the entries, then reconciles all of them.
     */
    @Transactional
    public void settleEntries(Collection<UUID> entryIds) {
        for (UUID entryId : entryIds) {
            JournalEntry entry = ledgerService.getEntry(entryId);
            if (entry.getStatus() == EntryStatus.DRAFT) {
                ledgerService.post(entryId, entry.getVersion());
            }
            ledgerService.reconcile(entryId);
        }
    }

    private ReconciliationMatch loadPending(UUID matchId, long expectedVersion) {
        ReconciliationMatch match = matches.getById(matchId);
        if (match.getStatus() != MatchStatus.PENDING_REVIEW) {
            throw new AlreadyProcessedException(AGGREGATE_TYPE, matchId, match.getStatus().name());
        }
        if (match.getVersion() != expectedVersion) {
            throw new VersionConflictException(AGGREGATE_TYPE, matchId, expectedVersion, match.getVersion());
        }
        return match;
    }

    private void requireUnblocked(ReconciliationMatch match) {
        List<ConsistencyCheck> blocking = consistencyChecker.blockingChecksFor(match);
        if (!blocking.isEmpty()) {
            throw new ConsistencyBlockException(match.getId(), blocking.stream().map(ConsistencyCheck::getId).toList());
        }
    }

    private void updateTransaction(UUID transactionId, BankTransactionStatus status) {
        BankTransactionEntity txn = transactionRepository.findById(transactionId)
            .orElseThrow(() -> new NotFoundException("BankTransaction", transactionId));
        txn.updateStatus(status);
        transactionRepository.save(txn);
    }
}
