package com.flagship.recon_ledger.review;

import com.flagship.recon_ledger.exception.ConsistencyBlockException;
import com.flagship.recon_ledger.ledger.AccountService;
import com.flagship.recon_ledger.ledger.LedgerService;
import com.flagship.recon_ledger.matching.MatchHistoryService;
import com.flagship.recon_ledger.matching.MatchPersistenceService;
import com.flagship.recon_ledger.matching.MatchRepository;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import com.flagship.recon_ledger.outbox.OutboxService;
import com.flagship.recon_ledger.scoring.ScoringEngine;
import com.flagship.recon_ledger.statement.BankTransactionRepository;
import com.flagship.recon_ledger.statement.CandidateSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Per-item outcome mapping of batch accept and reject.
 *
 * These tests verify that:
 * - Every item gets a result, whatever the previous item threw
 * - A concurrent update lost at commit is reported as a version conflict
 * - Unexpected errors are reported as FAILED instead of aborting the batch
 * - Blocked rejects carry the blocking check ids
 */
@ExtendWith(MockitoExtension.class)
class ReviewServiceBatchTest {

    @Mock
    private MatchDecisionService decisionService;
    @Mock
    private MatchPersistenceService matches;
    @Mock
    private MatchRepository matchRepository;
    @Mock
    private MatchHistoryService historyService;
    @Mock
    private BankTransactionRepository transactionRepository;
    @Mock
    private CandidateSource candidateSource;
    @Mock
    private ScoringEngine scoringEngine;
    @Mock
    private LedgerService ledgerService;
    @Mock
    private AccountService accountService;
    @Mock
    private OutboxService outboxService;
    @Mock
    private ReconciliationMetrics metrics;

    @InjectMocks
    private ReviewService reviewService;

    @Test
    @DisplayName("Lock race and database failure do not stop the remaining items")
    void testBatchAcceptContinuesAfterUnexpectedErrors() {
        UUID raced = UUID.randomUUID();
        UUID broken = UUID.randomUUID();
        UUID fine = UUID.randomUUID();
        when(decisionService.accept(raced, 0L, "close"))
            .thenThrow(new ObjectOptimisticLockingFailureException("Row was updated by another transaction", null));
        when(decisionService.accept(broken, 0L, "close"))
            .thenThrow(new DataAccessResourceFailureException("Connection reset"));
        when(decisionService.accept(fine, 0L, "close")).thenReturn(resolved(fine));

        List<BatchItemResult> results = reviewService.batchAccept(List.of(
            new BatchItem(raced, 0L), new BatchItem(broken, 0L), new BatchItem(fine, 0L)), "close");

        assertEquals(3, results.size());
        assertEquals(BatchItemResult.Result.VERSION_CONFLICT, results.get(0).getResult());
        assertEquals(BatchItemResult.Result.FAILED, results.get(1).getResult());
        assertEquals("Connection reset", results.get(1).getMessage());
        assertEquals(BatchItemResult.Result.OK, results.get(2).getResult());
        assertEquals(List.of(raced, broken, fine), results.stream().map(BatchItemResult::getMatchId).toList());
        verify(decisionService).accept(fine, 0L, "close");
    }

    @Test
    @DisplayName("Blocked reject is reported with its check ids and the next item still runs")
    void testBatchRejectReportsBlockedItems() {
        UUID blocked = UUID.randomUUID();
        UUID free = UUID.randomUUID();
        UUID checkId = UUID.randomUUID();
        when(decisionService.reject(blocked, 1L, "duplicate"))
            .thenThrow(new ConsistencyBlockException(blocked, List.of(checkId)));
        when(decisionService.reject(free, 2L, "duplicate")).thenReturn(resolved(free));

        List<BatchItemResult> results = reviewService.batchReject(List.of(
            new BatchItem(blocked, 1L), new BatchItem(free, 2L)), "duplicate");

        assertEquals(BatchItemResult.Result.BLOCKED, results.get(0).getResult());
        assertEquals(List.of(checkId), results.get(0).getBlockingCheckIds());
        assertEquals(BatchItemResult.Result.OK, results.get(1).getResult());
    }

    private static ReconciliationMatch resolved(UUID matchId) {
        return ReconciliationMatch.builder().id(matchId).build();
    }
}
