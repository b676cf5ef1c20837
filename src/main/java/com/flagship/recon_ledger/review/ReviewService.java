package com.flagship.recon_ledger.review;

import com.flagship.recon_ledger.event.MatchCreatedEvent;
import com.flagship.recon_ledger.event.MatchSupersededEvent;
import com.flagship.recon_ledger.exception.AlreadyProcessedException;
import com.flagship.recon_ledger.exception.ConsistencyBlockException;
import com.flagship.recon_ledger.exception.LedgerValidationException;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.exception.VersionConflictException;
import com.flagship.recon_ledger.ledger.AccountService;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.ledger.EntryStatus;
import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.ledger.JournalLine;
import com.flagship.recon_ledger.ledger.LedgerService;
import com.flagship.recon_ledger.ledger.SourceType;
import com.flagship.recon_ledger.matching.MatchEntity;
import com.flagship.recon_ledger.matching.MatchHistoryService;
import com.flagship.recon_ledger.matching.MatchPersistenceService;
import com.flagship.recon_ledger.matching.MatchRepository;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import com.flagship.recon_ledger.outbox.OutboxService;
import com.flagship.recon_ledger.scoring.CandidateEntry;
import com.flagship.recon_ledger.scoring.MatchScore;
import com.flagship.recon_ledger.scoring.ScoringEngine;
import com.flagship.recon_ledger.statement.BankTransaction;
import com.flagship.recon_ledger.statement.BankTransactionEntity;
import com.flagship.recon_ledger.statement.BankTransactionRepository;
import com.flagship.recon_ledger.statement.BankTransactionStatus;
import com.flagship.recon_ledger.statement.CandidateSource;
import com.flagship.recon_ledger.statement.ReconciliationScope;
import com.flagship.recon_ledger.statement.TransactionDirection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The review queue and the manual paths around it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewService {

    private static final String MATCH_AGGREGATE = "ReconciliationMatch";
    private static final String TRANSACTION_AGGREGATE = "BankTransaction";
    private static final Set<MatchStatus> CONFIRMED = EnumSet.of(MatchStatus.ACCEPTED, MatchStatus.AUTO_ACCEPTED);
    private static final Set<EntryStatus> LINKABLE = EnumSet.of(EntryStatus.DRAFT, EntryStatus.POSTED);

    private final MatchDecisionService decisionService;
    private final MatchPersistenceService matches;
    private final MatchRepository matchRepository;
    private final MatchHistoryService historyService;
    private final BankTransactionRepository transactionRepository;
    private final CandidateSource candidateSource;
    private final ScoringEngine scoringEngine;
    private final LedgerService ledgerService;
    private final AccountService accountService;
    private final OutboxService outboxService;
    private final ReconciliationMetrics metrics;

    @Transactional(readOnly = true)
    public Page<ReconciliationMatch> listPending(UUID accountId, Integer minScore, Integer maxScore,
                                                 Instant createdBefore, Pageable pageable) {
        return matchRepository.findQueue(MatchStatus.PENDING_REVIEW, accountId,
                minScore == null ? 0 : minScore,
                maxScore == null ? 100 : maxScore,
                createdBefore == null ? Instant.now() : createdBefore,
                pageable)
            .map(MatchEntity::toDomain);
    }

    public ReconciliationMatch accept(UUID matchId, long version, String note) {
        return decisionService.accept(matchId, version, note);
    }

    public ReconciliationMatch reject(UUID matchId, long version, String reason) {
        return decisionService.reject(matchId, version, reason);
    }

    /**
     * Accepts each item in its own transaction. One item's failure never affects another:
     * every item gets a result, including FAILED for unexpected errors.
     */
    public List<BatchItemResult> batchAccept(List<BatchItem> items, String note) {
        return runBatch("accept", items, item -> decisionService.accept(item.getMatchId(), item.getVersion(), note));
    }

    public List<BatchItemResult> batchReject(List<BatchItem> items, String reason) {
        return runBatch("reject", items, item -> decisionService.reject(item.getMatchId(), item.getVersion(), reason));
    }

    private List<BatchItemResult> runBatch(String operation, List<BatchItem> items,
                                           Function<BatchItem, ReconciliationMatch> decision) {
        List<BatchItemResult> results = new ArrayList<>(items.size());
        for (BatchItem item : items) {
            BatchItemResult result = decide(item, decision);
            metrics.recordBatchItem(operation, result.getResult().name());
            results.add(result);
        }
        long ok = results.stream().filter(BatchItemResult::isOk).count();
        log.info("Batch {} finished: items={}, ok={}, failed={}", operation, items.size(), ok, items.size() - ok);
        return results;
    }

    private BatchItemResult decide(BatchItem item, Function<BatchItem, ReconciliationMatch> decision) {
        UUID matchId = item.getMatchId();
        try {
            decision.apply(item);
            return BatchItemResult.ok(matchId);
        } catch (VersionConflictException e) {
            return BatchItemResult.failed(matchId, BatchItemResult.Result.VERSION_CONFLICT, e.getMessage());
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Batch item lost a concurrent update: matchId={}", matchId);
            return BatchItemResult.failed(matchId, BatchItemResult.Result.VERSION_CONFLICT,
                "Concurrent update detected: " + e.getMessage());
        } catch (AlreadyProcessedException e) {
            return BatchItemResult.failed(matchId, BatchItemResult.Result.ALREADY_PROCESSED, e.getMessage());
        } catch (ConsistencyBlockException e) {
            return BatchItemResult.blocked(matchId, e.getMessage(), e.getBlockingCheckIds());
        } catch (NotFoundException e) {
            return BatchItemResult.failed(matchId, BatchItemResult.Result.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException | IllegalStateException | LedgerValidationException e) {
            log.warn("Batch item refused: matchId={}, error={}", matchId, e.getMessage());
            return BatchItemResult.failed(matchId, BatchItemResult.Result.INVALID, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Batch item failed: matchId={}", matchId, e);
            return BatchItemResult.failed(matchId, BatchItemResult.Result.FAILED, e.getMessage());
        }
    }

    /**
     * Links a transaction to entries chosen by a person. The set is scored for the record,
     * any pending proposal is superseded, and the result is ACCEPTED immediately.
     */
    @Transactional
    public ReconciliationMatch manualMatch(UUID transactionId, Set<UUID> entryIds, String note) {
        if (entryIds == null || entryIds.isEmpty()) {
            throw new IllegalArgumentException("At least one journal entry is required");
        }
        BankTransactionEntity txnEntity = loadTransaction(transactionId);
        BankTransaction transaction = txnEntity.toDomain();
        if (transaction.isMatched()) {
            throw new AlreadyProcessedException(TRANSACTION_AGGREGATE, transactionId, BankTransactionStatus.MATCHED.name());
        }

        List<JournalEntry> entries = loadLinkableEntries(entryIds);
        List<CandidateEntry> candidates = candidateSource.asCandidates(entries);
        MatchScore score = scoringEngine.score(transaction, candidates, historyService.historyFor(transaction));

        ReconciliationMatch pending = matches.findForTransaction(transactionId).stream()
            .filter(m -> m.getStatus() == MatchStatus.PENDING_REVIEW)
            .findFirst()
            .orElse(null);

        ReconciliationMatch match = matches.insert(ReconciliationMatch.create(transactionId, score,
            MatchStatus.ACCEPTED, null, pending == null ? null : pending.getId(), note));
        outboxService.saveEvent(MATCH_AGGREGATE, match.getId(), MatchCreatedEvent.EVENT_TYPE,
            MatchCreatedEvent.from(match));

        if (pending != null) {
            matches.update(pending.supersede(match.getId()), pending.getVersion());
            outboxService.saveEvent(MATCH_AGGREGATE, pending.getId(), MatchSupersededEvent.EVENT_TYPE,
                MatchSupersededEvent.of(pending.getId(), match.getId(), transactionId));
            metrics.recordMatchSuperseded();
        }

        decisionService.settleEntries(match.getEntryIds());
        txnEntity.updateStatus(BankTransactionStatus.MATCHED);
        transactionRepository.save(txnEntity);

        metrics.recordMatchCreated(MatchStatus.ACCEPTED, match.getScore());
        metrics.recordMatchResolved(MatchStatus.ACCEPTED, "manual");
        log.info("Manual match: matchId={}, txnId={}, entries={}, score={}, supersededMatchId={}",
            match.getId(), transactionId, match.getEntryIds(), match.getScore(),
            pending == null ? null : pending.getId());
        return match;
    }

    /**
     * Books a balanced BANK_STATEMENT entry for a transaction with no ledger counterpart,
     * then links the two with an accepted manual match.
     */
    @Transactional
    public ReconciliationMatch createEntryFromTransaction(UUID transactionId, UUID counterAccountId, String memo) {
        BankTransaction transaction = loadTransaction(transactionId).toDomain();
        if (transaction.isMatched()) {
            throw new AlreadyProcessedException(TRANSACTION_AGGREGATE, transactionId, BankTransactionStatus.MATCHED.name());
        }
        if (counterAccountId.equals(transaction.getSourceAccountId())) {
            throw new IllegalArgumentException("Counter account must differ from the statement account");
        }
        accountService.getAccount(counterAccountId);

        UUID debitAccount = transaction.getDirection() == TransactionDirection.IN
            ? transaction.getSourceAccountId() : counterAccountId;
        UUID creditAccount = transaction.getDirection() == TransactionDirection.IN
            ? counterAccountId : transaction.getSourceAccountId();
        List<JournalLine> lines = List.of(
            JournalLine.of(debitAccount, Direction.DEBIT, transaction.getAmount(), transaction.getCurrency()),
            JournalLine.of(creditAccount, Direction.CREDIT, transaction.getAmount(), transaction.getCurrency()));

        String entryMemo = memo == null || memo.isBlank() ? transaction.getDescription() : memo;
        JournalEntry draft = ledgerService.createDraft(transaction.getTxnDate(), entryMemo, SourceType.BANK_STATEMENT, lines);
        log.info("Created entry from transaction: txnId={}, entryId={}", transactionId, draft.getId());

        return manualMatch(transactionId, Set.of(draft.getId()), "Entry created from bank transaction");
    }

    @Transactional(readOnly = true)
    public List<BankTransaction> listUnmatched(ReconciliationScope scope) {
        return transactionRepository.findInScope(EnumSet.of(BankTransactionStatus.UNMATCHED),
                scope.getAccountId(), scope.getBatchId(), scope.getDateFrom(), scope.getDateTo()).stream()
            .map(BankTransactionEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public ReviewStats stats(ReconciliationScope scope) {
        List<BankTransaction> transactions = transactionRepository.findInScope(
                EnumSet.allOf(BankTransactionStatus.class),
                scope.getAccountId(), scope.getBatchId(), scope.getDateFrom(), scope.getDateTo()).stream()
            .map(BankTransactionEntity::toDomain)
            .toList();

        Map<BankTransactionStatus, Long> byTxnStatus = transactions.stream()
            .collect(Collectors.groupingBy(BankTransaction::getStatus,
                () -> new EnumMap<>(BankTransactionStatus.class), Collectors.counting()));
        long total = transactions.size();
        long matched = byTxnStatus.getOrDefault(BankTransactionStatus.MATCHED, 0L);
        BigDecimal rate = total == 0 ? BigDecimal.ZERO.setScale(4)
            : BigDecimal.valueOf(matched).divide(BigDecimal.valueOf(total), 4, RoundingMode.HALF_UP);

        Set<UUID> txnIds = transactions.stream().map(BankTransaction::getId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        List<ReconciliationMatch> scoped = txnIds.isEmpty() ? List.of()
            : matchRepository.findByBankTransactionIdIn(txnIds).stream().map(MatchEntity::toDomain).toList();

        Map<MatchStatus, Long> byMatchStatus = new EnumMap<>(MatchStatus.class);
        for (MatchStatus status : MatchStatus.values()) {
            byMatchStatus.put(status, 0L);
        }
        Map<String, Long> histogram = new LinkedHashMap<>();
        for (ScoreBand band : ScoreBand.values()) {
            histogram.put(band.label(), 0L);
        }
        for (ReconciliationMatch match : scoped) {
            byMatchStatus.merge(match.getStatus(), 1L, Long::sum);
            if (match.getStatus() != MatchStatus.SUPERSEDED) {
                histogram.merge(ScoreBand.of(match.getScore()).label(), 1L, Long::sum);
            }
        }

        return new ReviewStats(total, matched,
            byTxnStatus.getOrDefault(BankTransactionStatus.UNMATCHED, 0L),
            byTxnStatus.getOrDefault(BankTransactionStatus.PENDING, 0L),
            rate, byMatchStatus, histogram);
    }

    private List<JournalEntry> loadLinkableEntries(Set<UUID> entryIds) {
        Map<UUID, JournalEntry> found = ledgerService.getEntries(entryIds).stream()
            .collect(Collectors.toMap(JournalEntry::getId, Function.identity()));
        for (UUID entryId : entryIds) {
            JournalEntry entry = found.get(entryId);
            if (entry == null) {
                throw new NotFoundException("JournalEntry", entryId);
            }
            if (!LINKABLE.contains(entry.getStatus()) || entry.isReversed()) {
                throw new AlreadyProcessedException("JournalEntry", entryId,
                    entry.isReversed() ? "REVERSED" : entry.getStatus().name());
            }
        }
        List<UUID> taken = matchRepository.findByEntryIdsAndStatusIn(entryIds, CONFIRMED).stream()
            .map(MatchEntity::getId)
            .toList();
        if (!taken.isEmpty()) {
            throw new IllegalStateException("Entries are already part of confirmed match(es) " + taken);
        }
        return entryIds.stream().sorted().map(found::get).toList();
    }

    private BankTransactionEntity loadTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
            .orElseThrow(() -> new NotFoundException(TRANSACTION_AGGREGATE, transactionId));
    }
}
