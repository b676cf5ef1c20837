package com.flagship.recon_ledger;

import com.flagship.recon_ledger.consistency.CheckRecorder;
import com.flagship.recon_ledger.consistency.CheckSubject;
import com.flagship.recon_ledger.consistency.CheckType;
import com.flagship.recon_ledger.consistency.DetectedIssue;
import com.flagship.recon_ledger.consistency.Severity;
import com.flagship.recon_ledger.exception.ConsistencyBlockException;
import com.flagship.recon_ledger.exception.LedgerValidationException;
import com.flagship.recon_ledger.ledger.Account;
import com.flagship.recon_ledger.ledger.AccountService;
import com.flagship.recon_ledger.ledger.AccountType;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.ledger.EntryStatus;
import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.ledger.JournalLine;
import com.flagship.recon_ledger.ledger.LedgerReportingService;
import com.flagship.recon_ledger.ledger.LedgerService;
import com.flagship.recon_ledger.ledger.SourceType;
import com.flagship.recon_ledger.ledger.ValidationFailure;
import com.flagship.recon_ledger.matching.MatchPersistenceService;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import com.flagship.recon_ledger.matching.ReconciliationRun;
import com.flagship.recon_ledger.matching.ReconciliationRunService;
import com.flagship.recon_ledger.matching.RunStatus;
import com.flagship.recon_ledger.review.BatchItem;
import com.flagship.recon_ledger.review.BatchItemResult;
import com.flagship.recon_ledger.review.ReviewService;
import com.flagship.recon_ledger.review.ReviewStats;
import com.flagship.recon_ledger.statement.BankTransactionStatus;
import com.flagship.recon_ledger.statement.IngestionResult;
import com.flagship.recon_ledger.statement.ReconciliationScope;
import com.flagship.recon_ledger.statement.StatementExtraction;
import com.flagship.recon_ledger.statement.StatementIngestionService;
import com.flagship.recon_ledger.statement.TransactionDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end reconciliation tests against a real database.
 *
 * These tests verify that:
 * - Only balanced entries post, and posted entries are frozen
 * - Exact matches auto-accept and reconcile their entries
 * - Weak candidates leave the transaction unmatched
 * - Runs are idempotent and rejected proposals never return
 * - Review decisions are exactly-once and respect blocking checks
 *
 * Each test books on its own block of dates so candidates from other tests
 * never fall inside its matching window.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ReconciliationFlowIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("recon_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka, the outbox publisher and scheduled checks for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("reconciliation.consistency.schedule-enabled", () -> "false");
        registry.add("reconciliation.auto-run-on-ingest", () -> "false");
    }

    private static final AtomicInteger DATE_BLOCK = new AtomicInteger();

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private LedgerReportingService reportingService;

    @Autowired
    private StatementIngestionService ingestionService;

    @Autowired
    private ReconciliationRunService runService;

    @Autowired
    private MatchPersistenceService matches;

    @Autowired
    private ReviewService reviewService;

    @Autowired
    private CheckRecorder checkRecorder;

    private Account bank;
    private Account income;
    private LocalDate day;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        bank = accountService.createAccount("BANK-" + suffix, "Operating account", AccountType.ASSET, "USD");
        income = accountService.createAccount("REV-" + suffix, "Consulting revenue", AccountType.INCOME, "USD");
        day = LocalDate.of(2020, 1, 1).plusDays(60L * DATE_BLOCK.incrementAndGet());
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("5000/5000 posts, 5000/4999.99 is refused with a 0.01 delta")
    void testPostingRequiresBalance() {
        printTestHeader("Posting Requires Balance");

        JournalEntry balanced = postedIncome("5000.00", "5000.00", day, "Invoice 1");
        assertEquals(EntryStatus.POSTED, balanced.getStatus());

        JournalEntry draft = ledgerService.createDraft(day, "Invoice 2", SourceType.MANUAL, List.of(
            JournalLine.of(bank.getId(), Direction.DEBIT, new BigDecimal("5000.00"), "USD"),
            JournalLine.of(income.getId(), Direction.CREDIT, new BigDecimal("4999.99"), "USD")));

        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> ledgerService.post(draft.getId(), draft.getVersion()));
        System.out.println("  Exception Message: " + e.getMessage());
        assertEquals(ValidationFailure.IMBALANCED, e.getFailure());
        assertEquals(0, new BigDecimal("0.01").compareTo(e.getResult().getDelta()));
        assertEquals(EntryStatus.DRAFT, ledgerService.getEntry(draft.getId()).getStatus());

        printSuccess("Only the balanced entry was posted");
    }

    @Test
    @DisplayName("Editing a posted entry fails with ENTRY_NOT_EDITABLE")
    void testPostedEntryNotEditable() {
        JournalEntry posted = postedIncome("100.00", "100.00", day, "Retainer");

        LedgerValidationException e = assertThrows(LedgerValidationException.class,
            () -> ledgerService.updateDraftLines(posted.getId(), posted.getVersion(), List.of(
                JournalLine.of(bank.getId(), Direction.DEBIT, new BigDecimal("1.00"), "USD"),
                JournalLine.of(income.getId(), Direction.CREDIT, new BigDecimal("1.00"), "USD"))));
        assertEquals(ValidationFailure.ENTRY_NOT_EDITABLE, e.getFailure());
    }

    @Test
    @DisplayName("Voiding a posted entry writes a reversal that nets balances to zero")
    void testReversalNetsToZero() {
        JournalEntry posted = postedIncome("250.00", "250.00", day, "Deposit");
        assertEquals(0, new BigDecimal("250.00").compareTo(reportingService.getAccountBalance(bank.getId())));

        JournalEntry reversal = ledgerService.voidEntry(posted.getId(), "Entered twice");

        assertEquals(EntryStatus.VOID, reversal.getStatus());
        assertEquals(posted.getId(), reversal.getReversalOfEntryId());
        assertEquals(reversal.getId(), ledgerService.getEntry(posted.getId()).getReversedByEntryId());
        assertEquals(0, BigDecimal.ZERO.compareTo(reportingService.getAccountBalance(bank.getId())));
        assertEquals(0, BigDecimal.ZERO.compareTo(reportingService.getAccountBalance(income.getId())));
    }

    @Test
    @DisplayName("Exact match scores at least 95, auto-accepts and reconciles the entry")
    void testExactMatchAutoAccepted() {
        printTestHeader("Exact Match Auto-Accepted");

        JournalEntry entry = postedIncome("5000.00", "5000.00", day, "Invoice 1042 ACME");
        IngestionResult ingested = ingest(true, line("5000.00", day, "Invoice 1042 ACME"));
        UUID txnId = ingested.getTransactionIds().get(0);

        ReconciliationRun run = runService.run(ReconciliationScope.batch(ingested.getBatch().getId()), null);

        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals(1, run.getSummary().getAutoAccepted());

        List<ReconciliationMatch> found = matches.findForTransaction(txnId);
        assertEquals(1, found.size());
        ReconciliationMatch match = found.get(0);
        System.out.println("OUTPUT - Score: " + match.getScore() + ", breakdown: " + match.getBreakdown());
        assertTrue(match.getScore() >= 95);
        assertEquals(MatchStatus.AUTO_ACCEPTED, match.getStatus());
        assertEquals(List.of(entry.getId()), match.getEntryIds());
        assertEquals(EntryStatus.RECONCILED, ledgerService.getEntry(entry.getId()).getStatus());
        assertEquals(BankTransactionStatus.MATCHED, ingestionService.getTransaction(txnId).getStatus());

        printSuccess("Transaction auto-matched to its entry");
    }

    @Test
    @DisplayName("87.50 against 100.00 ten days apart is left unmatched")
    void testWeakCandidateUnmatched() {
        JournalEntry entry = postedIncome("87.50", "87.50", day.plusDays(10), "Client payment");
        IngestionResult ingested = ingest(true, line("100.00", day, "Client payment"));
        UUID txnId = ingested.getTransactionIds().get(0);

        ReconciliationRun run = runService.run(ReconciliationScope.batch(ingested.getBatch().getId()), null);

        assertEquals(1, run.getSummary().getUnmatched());
        assertTrue(matches.findForTransaction(txnId).isEmpty());
        assertEquals(BankTransactionStatus.UNMATCHED, ingestionService.getTransaction(txnId).getStatus());
        assertEquals(EntryStatus.POSTED, ledgerService.getEntry(entry.getId()).getStatus());
        assertTrue(reviewService.listUnmatched(ReconciliationScope.batch(ingested.getBatch().getId())).stream()
            .anyMatch(t -> t.getId().equals(txnId)));
    }

    @Test
    @DisplayName("Low-trust statement holds even a perfect match for review")
    void testLowTrustStatementGoesToReview() {
        postedIncome("320.00", "320.00", day, "Subscription renewal");
        IngestionResult ingested = ingest(false, line("320.00", day, "Subscription renewal"));
        assertTrue(ingested.getBatch().isLowTrust());

        runService.run(ReconciliationScope.batch(ingested.getBatch().getId()), null);

        ReconciliationMatch match = matches.findForTransaction(ingested.getTransactionIds().get(0)).get(0);
        assertEquals(MatchStatus.PENDING_REVIEW, match.getStatus());
        assertTrue(match.getScore() >= 85);
    }

    @Test
    @DisplayName("Same idempotency key returns the same run, reruns skip matched transactions")
    void testIdempotentRuns() {
        postedIncome("75.00", "75.00", day, "Workshop fee");
        IngestionResult ingested = ingest(true, line("75.00", day, "Workshop fee"));
        ReconciliationScope scope = ReconciliationScope.batch(ingested.getBatch().getId());
        String key = "run-" + UUID.randomUUID();

        ReconciliationRun first = runService.run(scope, key);
        ReconciliationRun replay = runService.run(scope, key);
        ReconciliationRun rerun = runService.run(scope, null);

        assertEquals(first.getId(), replay.getId());
        assertEquals(first.getSummary(), replay.getSummary());
        assertNotEquals(first.getId(), rerun.getId());
        assertEquals(0, rerun.getSummary().getMatchesCreated());
        assertEquals(1, matches.findForTransaction(ingested.getTransactionIds().get(0)).size());
    }

    @Test
    @DisplayName("Rejected match is never proposed again")
    void testRejectedMatchNotResurrected() {
        JournalEntry entry = postedIncome("410.00", "410.00", day, "Design sprint");
        IngestionResult ingested = ingest(false, line("410.00", day, "Design sprint"));
        ReconciliationScope scope = ReconciliationScope.batch(ingested.getBatch().getId());
        UUID txnId = ingested.getTransactionIds().get(0);

        runService.run(scope, null);
        ReconciliationMatch pending = matches.findForTransaction(txnId).get(0);
        reviewService.reject(pending.getId(), pending.getVersion(), "Different client");

        ReconciliationRun rerun = runService.run(scope, null);

        List<ReconciliationMatch> all = matches.findForTransaction(txnId);
        assertEquals(1, all.size());
        assertEquals(MatchStatus.REJECTED, all.get(0).getStatus());
        assertEquals(0, rerun.getSummary().getMatchesCreated());
        assertEquals(BankTransactionStatus.UNMATCHED, ingestionService.getTransaction(txnId).getStatus());
        assertEquals(EntryStatus.POSTED, ledgerService.getEntry(entry.getId()).getStatus());
    }

    @Test
    @DisplayName("Concurrent accepts of the same match succeed exactly once")
    void testConcurrentAcceptOnce() throws InterruptedException {
        printTestHeader("Concurrent Accept");

        JournalEntry entry = postedIncome("990.00", "990.00", day, "Audit services");
        IngestionResult ingested = ingest(false, line("990.00", day, "Audit services"));
        runService.run(ReconciliationScope.batch(ingested.getBatch().getId()), null);
        ReconciliationMatch pending = matches.findForTransaction(ingested.getTransactionIds().get(0)).get(0);

        int threadCount = 5;
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    reviewService.accept(pending.getId(), pending.getVersion(), "ok");
                    successes.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        System.out.println("OUTPUT - successes=" + successes.get() + ", failures=" + failures.get());
        assertEquals(1, successes.get());
        assertEquals(threadCount - 1, failures.get());
        assertEquals(MatchStatus.ACCEPTED, matches.getById(pending.getId()).getStatus());
        assertEquals(EntryStatus.RECONCILED, ledgerService.getEntry(entry.getId()).getStatus());

        printSuccess("Exactly one accept won");
    }

    @Test
    @DisplayName("Batch item blocked by a MEDIUM check is refused with the check id")
    void testBatchAcceptRespectsBlockingChecks() {
        postedIncome("130.00", "130.00", day, "Hosting March");
        postedIncome("145.00", "145.00", day.plusDays(1), "Hosting April");
        IngestionResult ingested = ingest(false,
            line("130.00", day, "Hosting March"),
            line("145.00", day.plusDays(1), "Hosting April"));
        runService.run(ReconciliationScope.batch(ingested.getBatch().getId()), null);

        ReconciliationMatch blocked = matches.findForTransaction(ingested.getTransactionIds().get(0)).get(0);
        ReconciliationMatch free = matches.findForTransaction(ingested.getTransactionIds().get(1)).get(0);
        DetectedIssue issue = new DetectedIssue(CheckType.DUPLICATE_TRANSACTION, Severity.MEDIUM,
            List.of(CheckSubject.transaction(blocked.getBankTransactionId()), CheckSubject.match(blocked.getId())),
            Map.of());

        assertEquals(CheckRecorder.Outcome.RAISED, checkRecorder.record(issue));
        assertEquals(CheckRecorder.Outcome.ALREADY_KNOWN, checkRecorder.record(issue));

        assertThrows(ConsistencyBlockException.class,
            () -> reviewService.accept(blocked.getId(), blocked.getVersion(), null));

        List<BatchItemResult> results = reviewService.batchAccept(List.of(
            new BatchItem(blocked.getId(), blocked.getVersion()),
            new BatchItem(free.getId(), free.getVersion()),
            new BatchItem(UUID.randomUUID(), 0L)), "monthly close");

        assertEquals(BatchItemResult.Result.BLOCKED, results.get(0).getResult());
        assertEquals(1, results.get(0).getBlockingCheckIds().size());
        assertEquals(BatchItemResult.Result.OK, results.get(1).getResult());
        assertEquals(BatchItemResult.Result.NOT_FOUND, results.get(2).getResult());
        assertEquals(MatchStatus.PENDING_REVIEW, matches.getById(blocked.getId()).getStatus());
        assertEquals(MatchStatus.ACCEPTED, matches.getById(free.getId()).getStatus());
    }

    @Test
    @DisplayName("Batch reject refuses a match held by a HIGH check and leaves it pending")
    void testBatchRejectRespectsBlockingChecks() {
        postedIncome("215.00", "215.00", day, "Licence renewal");
        postedIncome("230.00", "230.00", day.plusDays(1), "Support plan");
        IngestionResult ingested = ingest(false,
            line("215.00", day, "Licence renewal"),
            line("230.00", day.plusDays(1), "Support plan"));
        runService.run(ReconciliationScope.batch(ingested.getBatch().getId()), null);

        ReconciliationMatch blocked = matches.findForTransaction(ingested.getTransactionIds().get(0)).get(0);
        ReconciliationMatch free = matches.findForTransaction(ingested.getTransactionIds().get(1)).get(0);
        checkRecorder.record(new DetectedIssue(CheckType.DUPLICATE_TRANSACTION, Severity.HIGH,
            List.of(CheckSubject.match(blocked.getId())), Map.of()));

        assertThrows(ConsistencyBlockException.class,
            () -> reviewService.reject(blocked.getId(), blocked.getVersion(), "not ours"));

        List<BatchItemResult> results = reviewService.batchReject(List.of(
            new BatchItem(blocked.getId(), blocked.getVersion()),
            new BatchItem(free.getId(), free.getVersion())), "not ours");

        assertEquals(BatchItemResult.Result.BLOCKED, results.get(0).getResult());
        assertEquals(1, results.get(0).getBlockingCheckIds().size());
        assertEquals(BatchItemResult.Result.OK, results.get(1).getResult());
        assertEquals(MatchStatus.PENDING_REVIEW, matches.getById(blocked.getId()).getStatus());
        assertEquals(MatchStatus.REJECTED, matches.getById(free.getId()).getStatus());
        assertEquals(BankTransactionStatus.UNMATCHED,
            ingestionService.getTransaction(ingested.getTransactionIds().get(1)).getStatus());
    }

    @Test
    @DisplayName("Stale version is refused and a decided match cannot be decided again")
    void testVersionAndFinality() {
        postedIncome("60.00", "60.00", day, "Parking refund");
        IngestionResult ingested = ingest(false, line("60.00", day, "Parking refund"));
        runService.run(ReconciliationScope.batch(ingested.getBatch().getId()), null);
        ReconciliationMatch pending = matches.findForTransaction(ingested.getTransactionIds().get(0)).get(0);

        List<BatchItemResult> stale = reviewService.batchAccept(
            List.of(new BatchItem(pending.getId(), pending.getVersion() + 1)), null);
        assertEquals(BatchItemResult.Result.VERSION_CONFLICT, stale.get(0).getResult());

        reviewService.accept(pending.getId(), pending.getVersion(), null);

        List<BatchItemResult> again = reviewService.batchReject(
            List.of(new BatchItem(pending.getId(), pending.getVersion())), "too late");
        assertEquals(BatchItemResult.Result.ALREADY_PROCESSED, again.get(0).getResult());
    }

    @Test
    @DisplayName("Manual match and entry-from-transaction link and settle immediately")
    void testManualPaths() {
        JournalEntry draft = ledgerService.createDraft(day, "Bonus payment", SourceType.MANUAL, List.of(
            JournalLine.of(bank.getId(), Direction.DEBIT, new BigDecimal("500.00"), "USD"),
            JournalLine.of(income.getId(), Direction.CREDIT, new BigDecimal("500.00"), "USD")));
        IngestionResult ingested = ingest(true,
            line("500.00", day.plusDays(2), "Transfer ref 88"),
            line("12.34", day.plusDays(3), "Interest"));
        UUID manualTxn = ingested.getTransactionIds().get(0);
        UUID bookedTxn = ingested.getTransactionIds().get(1);

        ReconciliationMatch manual = reviewService.manualMatch(manualTxn, Set.of(draft.getId()), "confirmed by phone");
        assertEquals(MatchStatus.ACCEPTED, manual.getStatus());
        assertEquals(EntryStatus.RECONCILED, ledgerService.getEntry(draft.getId()).getStatus());
        assertEquals(BankTransactionStatus.MATCHED, ingestionService.getTransaction(manualTxn).getStatus());

        ReconciliationMatch booked = reviewService.createEntryFromTransaction(bookedTxn, income.getId(), null);
        assertEquals(MatchStatus.ACCEPTED, booked.getStatus());
        JournalEntry created = ledgerService.getEntry(booked.getEntryIds().get(0));
        assertEquals(SourceType.BANK_STATEMENT, created.getSourceType());
        assertEquals(EntryStatus.RECONCILED, created.getStatus());
        assertEquals("Interest", created.getMemo());

        ReviewStats stats = reviewService.stats(ReconciliationScope.batch(ingested.getBatch().getId()));
        assertEquals(2, stats.getTotalTransactions());
        assertEquals(2, stats.getMatched());
        assertEquals(0, new BigDecimal("1").compareTo(stats.getMatchRate()));
        assertEquals(2L, stats.getMatchesByStatus().get(MatchStatus.ACCEPTED));
    }

    private JournalEntry postedIncome(String debit, String credit, LocalDate date, String memo) {
        JournalEntry draft = ledgerService.createDraft(date, memo, SourceType.MANUAL, List.of(
            JournalLine.of(bank.getId(), Direction.DEBIT, new BigDecimal(debit), "USD"),
            JournalLine.of(income.getId(), Direction.CREDIT, new BigDecimal(credit), "USD")));
        return ledgerService.post(draft.getId(), draft.getVersion());
    }

    private IngestionResult ingest(boolean trusted, StatementExtraction.Line... lines) {
        BigDecimal total = BigDecimal.ZERO;
        List<StatementExtraction.Line> all = new ArrayList<>(List.of(lines));
        for (StatementExtraction.Line line : all) {
            total = total.add(line.getAmount());
        }
        BigDecimal closing = trusted ? total : total.add(BigDecimal.ONE);
        return ingestionService.ingest(new StatementExtraction(bank.getId(), day, day.plusDays(30),
            BigDecimal.ZERO, closing, "USD", "stmt-" + day, trusted, all));
    }

    private static StatementExtraction.Line line(String amount, LocalDate date, String description) {
        return new StatementExtraction.Line(date, new BigDecimal(amount), TransactionDirection.IN, description,
            null, null);
    }
}
