package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.consistency.CheckRecorder;
import com.flagship.recon_ledger.consistency.CheckSubject;
import com.flagship.recon_ledger.consistency.CheckType;
import com.flagship.recon_ledger.consistency.DetectedIssue;
import com.flagship.recon_ledger.consistency.Severity;
import com.flagship.recon_ledger.event.MatchCreatedEvent;
import com.flagship.recon_ledger.event.MatchSupersededEvent;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.ledger.LedgerService;
import com.flagship.recon_ledger.observability.CorrelationContext;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import com.flagship.recon_ledger.outbox.OutboxService;
import com.flagship.recon_ledger.routing.RoutingContext;
import com.flagship.recon_ledger.routing.RoutingDecision;
import com.flagship.recon_ledger.routing.RoutingOutcome;
import com.flagship.recon_ledger.routing.ThresholdPolicyService;
import com.flagship.recon_ledger.routing.ThresholdRouter;
import com.flagship.recon_ledger.routing.Thresholds;
import com.flagship.recon_ledger.scoring.CandidateEntry;
import com.flagship.recon_ledger.scoring.MatchHistory;
import com.flagship.recon_ledger.scoring.MatchScore;
import com.flagship.recon_ledger.scoring.ScoringEngine;
import com.flagship.recon_ledger.statement.BankTransaction;
import com.flagship.recon_ledger.statement.BankTransactionEntity;
import com.flagship.recon_ledger.statement.BankTransactionRepository;
import com.flagship.recon_ledger.statement.BankTransactionStatus;
import com.flagship.recon_ledger.statement.CandidateSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Matches a single bank transaction against the ledger.
 *
 * Each call runs in its own transaction so one failing transaction never rolls back
 * the rest of a run. Outcomes:
 * <ul>
 *   <li>already matched or confirmed: skipped</li>
 *   <li>no candidate above the review floor: transaction marked UNMATCHED</li>
 *   <li>a pending match exists: replaced only by a different entry set with a strictly
 *       higher score, otherwise left alone</li>
 *   <li>auto-accept: the entries are reconciled and the transaction marked MATCHED</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionMatcher {

    static final String AGGREGATE_TYPE = "ReconciliationMatch";
    private static final Set<MatchStatus> CONFIRMED = EnumSet.of(MatchStatus.ACCEPTED, MatchStatus.AUTO_ACCEPTED);

    private final BankTransactionRepository transactionRepository;
    private final MatchRepository matchRepository;
    private final CandidateSource candidateSource;
    private final MatchHistoryService historyService;
    private final ScoringEngine scoringEngine;
    private final ThresholdPolicyService thresholdPolicy;
    private final ThresholdRouter router;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final CheckRecorder checkRecorder;
    private final ReconciliationMetrics metrics;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public MatchOutcome matchTransaction(UUID transactionId, UUID runId) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            return metrics.timeTransactionMatch(() -> doMatch(transactionId, runId));
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private MatchOutcome doMatch(UUID transactionId, UUID runId) {
        BankTransactionEntity txnEntity = transactionRepository.findById(transactionId)
            .orElseThrow(() -> new NotFoundException("BankTransaction", transactionId));
        BankTransaction transaction = txnEntity.toDomain();
        if (transaction.isMatched()) {
            return MatchOutcome.skipped();
        }

        List<ReconciliationMatch> existing = matchRepository
            .findByBankTransactionIdOrderByCreatedAtAsc(transactionId).stream()
            .map(MatchEntity::toDomain)
            .toList();
        if (existing.stream().anyMatch(m -> m.getStatus().isConfirmed())) {
            log.debug("Transaction already has a confirmed match: txnId={}", transactionId);
            return MatchOutcome.skipped();
        }
        Set<Set<UUID>> rejectedSets = existing.stream()
            .filter(m -> m.getStatus() == MatchStatus.REJECTED)
            .map(ReconciliationMatch::entrySet)
            .collect(Collectors.toSet());
        Optional<MatchEntity> pendingEntity = existing.stream()
            .filter(m -> m.getStatus() == MatchStatus.PENDING_REVIEW)
            .findFirst()
            .flatMap(m -> matchRepository.findById(m.getId()));

        List<CandidateEntry> candidates = withoutConfirmedEntries(candidateSource.candidatesFor(transaction));
        MatchHistory history = historyService.historyFor(transaction);
        Optional<MatchScore> best = scoringEngine.best(transaction, candidates, history, rejectedSets::contains);

        if (best.isEmpty()) {
            return noMatch(txnEntity, pendingEntity);
        }

        MatchScore score = best.get();
        Thresholds thresholds = thresholdPolicy.thresholdsFor(transaction.getSourceAccountId());
        RoutingDecision decision = router.route(score.getScore(), thresholds, RoutingContext.of(transaction, score));
        metrics.recordRouting(decision);

        if (decision.getOutcome() == RoutingOutcome.UNMATCHED) {
            return noMatch(txnEntity, pendingEntity);
        }

        ReconciliationMatch pending = pendingEntity.map(MatchEntity::toDomain).orElse(null);
        if (pending != null
                && (pending.hasEntrySet(Set.copyOf(score.entryIds())) || score.getScore() <= pending.getScore())) {
            log.debug("Keeping pending match: txnId={}, matchId={}, pendingScore={}, bestScore={}",
                transactionId, pending.getId(), pending.getScore(), score.getScore());
            return MatchOutcome.unchanged(pending.getId());
        }

        MatchStatus status = decision.getOutcome() == RoutingOutcome.AUTO_ACCEPT
            ? MatchStatus.AUTO_ACCEPTED : MatchStatus.PENDING_REVIEW;
        ReconciliationMatch match = ReconciliationMatch.create(transactionId, score, status, runId,
            pending == null ? null : pending.getId(), null);
        matchRepository.saveAndFlush(MatchEntity.fromDomain(match));
        outboxService.saveEvent(AGGREGATE_TYPE, match.getId(), MatchCreatedEvent.EVENT_TYPE,
            MatchCreatedEvent.from(match));

        if (pending != null) {
            MatchEntity oldEntity = pendingEntity.get();
            oldEntity.updateFromDomain(pending.supersede(match.getId()));
            matchRepository.save(oldEntity);
            outboxService.saveEvent(AGGREGATE_TYPE, pending.getId(), MatchSupersededEvent.EVENT_TYPE,
                MatchSupersededEvent.of(pending.getId(), match.getId(), transactionId));
            metrics.recordMatchSuperseded();
            log.info("Superseded match: oldMatchId={}, newMatchId={}, oldScore={}, newScore={}",
                pending.getId(), match.getId(), pending.getScore(), match.getScore());
        }

        if (status == MatchStatus.AUTO_ACCEPTED) {
            match.getEntryIds().forEach(ledgerService::reconcile);
            txnEntity.updateStatus(BankTransactionStatus.MATCHED);
        } else {
            txnEntity.updateStatus(BankTransactionStatus.PENDING);
        }
        transactionRepository.save(txnEntity);

        if (score.getBreakdown().isHistoryDeviation()) {
            checkRecorder.record(patternDeviation(transaction, match));
        }

        metrics.recordMatchCreated(status, match.getScore());
        log.info("Created match: matchId={}, txnId={}, status={}, score={}, entries={}, cappedBy={}",
            match.getId(), transactionId, status, match.getScore(), match.getEntryIds(), decision.getCappedBy());
        return MatchOutcome.created(status, match.getId(), pending != null);
    }

    private MatchOutcome noMatch(BankTransactionEntity txnEntity, Optional<MatchEntity> pendingEntity) {
        if (pendingEntity.isPresent()) {
            return MatchOutcome.unchanged(pendingEntity.get().getId());
        }
        txnEntity.updateStatus(BankTransactionStatus.UNMATCHED);
        transactionRepository.save(txnEntity);
        return MatchOutcome.unmatched();
    }

    /**
     * Drops entries some other transaction has already been confirmed against.
     */
    private List<CandidateEntry> withoutConfirmedEntries(List<CandidateEntry> candidates) {
        if (candidates.isEmpty()) {
            return candidates;
        }
        Set<UUID> ids = candidates.stream().map(CandidateEntry::getEntryId).collect(Collectors.toSet());
        Set<UUID> taken = matchRepository.findByEntryIdsAndStatusIn(ids, CONFIRMED).stream()
            .flatMap(m -> m.getEntryIds().stream())
            .collect(Collectors.toSet());
        if (taken.isEmpty()) {
            return candidates;
        }
        return candidates.stream().filter(c -> !taken.contains(c.getEntryId())).toList();
    }

    private static DetectedIssue patternDeviation(BankTransaction transaction, ReconciliationMatch match) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("amount", transaction.getAmount().toPlainString());
        details.put("description", transaction.getDescription());
        details.put("match_score", match.getScore());
        return new DetectedIssue(CheckType.PATTERN_DEVIATION, Severity.LOW,
            List.of(CheckSubject.transaction(transaction.getId()), CheckSubject.match(match.getId())),
            details);
    }
}
