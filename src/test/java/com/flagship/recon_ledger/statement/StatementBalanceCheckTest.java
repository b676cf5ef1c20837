package com.flagship.recon_ledger.statement;

import com.flagship.recon_ledger.statement.dto.StatementSubmissionRequest;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StatementBalanceCheckTest {

    private static final LocalDate DAY = LocalDate.of(2024, 4, 2);

    @Test
    @DisplayName("Opening plus inflows minus outflows equals closing")
    void testBalanced() {
        assertTrue(StatementIngestionService.balanceCheck(extraction("1000.00", "1350.00",
            line("500.00", TransactionDirection.IN), line("150.00", TransactionDirection.OUT))));
    }

    @Test
    @DisplayName("A one cent gap is tolerated, two cents is not")
    void testTolerance() {
        assertTrue(StatementIngestionService.balanceCheck(extraction("1000.00", "1350.01",
            line("500.00", TransactionDirection.IN), line("150.00", TransactionDirection.OUT))));
        assertFalse(StatementIngestionService.balanceCheck(extraction("1000.00", "1350.02",
            line("500.00", TransactionDirection.IN), line("150.00", TransactionDirection.OUT))));
    }

    @Test
    @DisplayName("Missing balances cannot be verified")
    void testMissingBalances() {
        assertFalse(StatementIngestionService.balanceCheck(extraction(null, "100.00",
            line("100.00", TransactionDirection.IN))));
        assertFalse(StatementIngestionService.balanceCheck(extraction("0.00", null,
            line("100.00", TransactionDirection.IN))));
    }

    @Test
    @DisplayName("Batch is low-trust unless both balance checks pass")
    void testLowTrust() {
        assertFalse(batch(true, true).isLowTrust());
        assertTrue(batch(false, true).isLowTrust());
        assertTrue(batch(true, false).isLowTrust());
    }

    @Test
    @DisplayName("Missing extractor verdict counts as failed")
    void testSubmissionDefaults() {
        StatementSubmissionRequest request = new StatementSubmissionRequest(UUID.randomUUID(), DAY, DAY,
            new BigDecimal("0.00"), new BigDecimal("10.00"), "USD", "doc-1", null,
            List.of(new StatementSubmissionRequest.Line(DAY, new BigDecimal("10.00"), TransactionDirection.IN,
                "Deposit", "R1", null)));

        StatementExtraction extraction = request.toExtraction();
        assertFalse(extraction.isExtractorBalanceOk());
        assertEquals(1, extraction.getTransactions().size());
        assertEquals("Deposit", extraction.getTransactions().get(0).getDescription());
    }

    @Test
    @DisplayName("Statement amounts beyond four decimal places fail validation and cannot become transactions")
    void testAmountScale() {
        StatementSubmissionRequest request = new StatementSubmissionRequest(UUID.randomUUID(), DAY, DAY,
            new BigDecimal("0.00"), new BigDecimal("10.12345"), "USD", "doc-2", true,
            List.of(new StatementSubmissionRequest.Line(DAY, new BigDecimal("10.12345"), TransactionDirection.IN,
                "Deposit", null, null)));

        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Set<String> paths = factory.getValidator().validate(request).stream()
                .map(v -> v.getPropertyPath().toString())
                .collect(Collectors.toSet());
            assertEquals(Set.of("closingBalance", "transactions[0].amount"), paths);
        }

        assertThrows(IllegalArgumentException.class, () -> BankTransaction.create(UUID.randomUUID(),
            UUID.randomUUID(), DAY, new BigDecimal("10.12345"), TransactionDirection.IN, "Deposit", null, "USD", false));
    }

    private static StatementBatch batch(boolean extractorOk, boolean computedOk) {
        return new StatementBatch(UUID.randomUUID(), UUID.randomUUID(), DAY, DAY, BigDecimal.ZERO, BigDecimal.ZERO,
            "USD", null, extractorOk, computedOk, 1, null);
    }

    private static StatementExtraction extraction(String opening, String closing, StatementExtraction.Line... lines) {
        return new StatementExtraction(UUID.randomUUID(), DAY, DAY,
            opening == null ? null : new BigDecimal(opening),
            closing == null ? null : new BigDecimal(closing),
            "USD", "doc", true, List.of(lines));
    }

    private static StatementExtraction.Line line(String amount, TransactionDirection direction) {
        return new StatementExtraction.Line(DAY, new BigDecimal(amount), direction, "x", null, null);
    }
}
