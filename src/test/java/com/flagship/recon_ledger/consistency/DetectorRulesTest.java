package com.flagship.recon_ledger.consistency;

import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import com.flagship.recon_ledger.statement.BankTransaction;
import com.flagship.recon_ledger.statement.TransactionDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Detection rules, exercised without a database.
 */
class DetectorRulesTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    @Test
    @DisplayName("Opposite legs of equal amount within the window pair up")
    void testTransferPairs() {
        UUID clearing = UUID.randomUUID();
        List<UnpairedTransferDetector.Leg> legs = List.of(
            leg(clearing, "2024-06-01", Direction.DEBIT, "500.00"),
            leg(clearing, "2024-06-03", Direction.CREDIT, "500.00"));

        assertTrue(UnpairedTransferDetector.findUnpaired(legs, 3, TODAY).isEmpty());
    }

    @Test
    @DisplayName("Leg without counterpart is reported, HIGH once twice the window old")
    void testUnpairedSeverity() {
        UUID clearing = UUID.randomUUID();
        List<UnpairedTransferDetector.Leg> legs = List.of(
            leg(clearing, "2024-06-01", Direction.DEBIT, "500.00"),
            leg(clearing, "2024-06-25", Direction.DEBIT, "75.00"),
            leg(clearing, "2024-06-29", Direction.DEBIT, "10.00"));

        List<DetectedIssue> issues = UnpairedTransferDetector.findUnpaired(legs, 3, TODAY);

        // the 29th is still inside its window
        assertEquals(2, issues.size());
        assertEquals(Severity.HIGH, issues.get(0).getSeverity());
        assertEquals(Severity.MEDIUM, issues.get(1).getSeverity());
        assertEquals(CheckType.UNPAIRED_TRANSFER, issues.get(0).getType());
    }

    @Test
    @DisplayName("Legs outside the window or of different amounts do not pair")
    void testNoFalsePairing() {
        UUID clearing = UUID.randomUUID();
        List<UnpairedTransferDetector.Leg> legs = List.of(
            leg(clearing, "2024-06-01", Direction.DEBIT, "500.00"),
            leg(clearing, "2024-06-02", Direction.CREDIT, "499.00"),
            leg(clearing, "2024-06-10", Direction.CREDIT, "500.00"));

        assertEquals(3, UnpairedTransferDetector.findUnpaired(legs, 3, TODAY).size());
    }

    @Test
    @DisplayName("Same amount, direction and description a day apart is a duplicate")
    void testDuplicateTransactions() {
        UUID account = UUID.randomUUID();
        BankTransaction first = txn(account, "2024-06-10", "49.99", "NETFLIX.COM 866");
        BankTransaction second = txn(account, "2024-06-11", "49.99", "netflix com 866");
        BankTransaction later = txn(account, "2024-06-20", "49.99", "NETFLIX.COM 866");
        BankTransaction other = txn(UUID.randomUUID(), "2024-06-10", "49.99", "NETFLIX.COM 866");

        List<DetectedIssue> issues = DuplicateTransactionDetector.findDuplicates(List.of(first, second, later, other));

        assertEquals(1, issues.size());
        assertEquals(Severity.MEDIUM, issues.get(0).getSeverity());
        assertTrue(issues.get(0).getSubjects().contains(CheckSubject.transaction(first.getId())));
        assertTrue(issues.get(0).getSubjects().contains(CheckSubject.transaction(second.getId())));
    }

    @Test
    @DisplayName("Stale review becomes MEDIUM past twice the allowed age")
    void testStaleReviewSeverity() {
        Duration maxAge = Duration.ofDays(7);
        ReconciliationMatch match = ReconciliationMatch.builder()
            .id(UUID.randomUUID())
            .bankTransactionId(UUID.randomUUID())
            .entryIds(List.of(UUID.randomUUID()))
            .score(70)
            .status(MatchStatus.PENDING_REVIEW)
            .createdAt(Instant.parse("2024-06-01T00:00:00Z"))
            .build();

        assertEquals(Severity.LOW,
            StaleReviewDetector.toIssue(match, Instant.parse("2024-06-10T00:00:00Z"), maxAge).getSeverity());
        assertEquals(Severity.MEDIUM,
            StaleReviewDetector.toIssue(match, Instant.parse("2024-06-20T00:00:00Z"), maxAge).getSeverity());
    }

    private static UnpairedTransferDetector.Leg leg(UUID account, String date, Direction direction, String amount) {
        return new UnpairedTransferDetector.Leg(UUID.randomUUID(), UUID.randomUUID(), account, LocalDate.parse(date),
            direction, new BigDecimal(amount));
    }

    private static BankTransaction txn(UUID account, String date, String amount, String description) {
        return BankTransaction.create(UUID.randomUUID(), account, LocalDate.parse(date), new BigDecimal(amount),
            TransactionDirection.OUT, description, null, "USD", false);
    }
}
