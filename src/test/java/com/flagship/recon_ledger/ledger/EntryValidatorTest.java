package com.flagship.recon_ledger.ledger;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EntryValidatorTest {

    private EntryValidator validator;
    private ReconciliationProperties properties;
    private Account cash;
    private Account revenue;
    private Account euroCash;
    private Account clearing;
    private Map<UUID, Account> accounts;

    @BeforeEach
    void setUp() {
        cash = Account.create(UUID.randomUUID(), "1000", "Cash", AccountType.ASSET, "USD");
        revenue = Account.create(UUID.randomUUID(), "4000", "Revenue", AccountType.INCOME, "USD");
        euroCash = Account.create(UUID.randomUUID(), "1010", "Cash EUR", AccountType.ASSET, "EUR");
        clearing = Account.create(UUID.randomUUID(), "1900", "Clearing", AccountType.ASSET, "USD");

        properties = new ReconciliationProperties();
        properties.getClearingAccountIds().add(clearing.getId());
        validator = new EntryValidator(properties);
        accounts = Map.of(cash.getId(), cash, revenue.getId(), revenue, euroCash.getId(), euroCash,
            clearing.getId(), clearing);
    }

    @Test
    @DisplayName("Balanced 5000/5000 entry is valid")
    void testBalancedIsValid() {
        ValidationResult result = validator.validate(entry(SourceType.MANUAL,
            line(cash, Direction.DEBIT, "5000.00"), line(revenue, Direction.CREDIT, "5000.00")), accounts);
        assertTrue(result.isValid());
    }

    @Test
    @DisplayName("5000/4999.99 is imbalanced by 0.01 with the credit side short")
    void testImbalanceReportsDelta() {
        ValidationResult result = validator.validate(entry(SourceType.MANUAL,
            line(cash, Direction.DEBIT, "5000.00"), line(revenue, Direction.CREDIT, "4999.99")), accounts);

        assertFalse(result.isValid());
        assertEquals(ValidationFailure.IMBALANCED, result.getFailure());
        assertEquals(0, new BigDecimal("0.01").compareTo(result.getDelta()));
        assertEquals(Direction.CREDIT, result.getShortSide());
    }

    @Test
    @DisplayName("Single-line entry has too few lines")
    void testTooFewLines() {
        ValidationResult result = validator.validate(entry(SourceType.MANUAL,
            line(cash, Direction.DEBIT, "10.00")), accounts);
        assertEquals(ValidationFailure.TOO_FEW_LINES, result.getFailure());
    }

    @Test
    @DisplayName("Zero amount, unknown account and inactive account are refused")
    void testLineFailures() {
        assertEquals(ValidationFailure.NON_POSITIVE_AMOUNT, validator.validate(entry(SourceType.MANUAL,
            line(cash, Direction.DEBIT, "0.00"), line(revenue, Direction.CREDIT, "0.00")), accounts).getFailure());

        Account stranger = Account.create(UUID.randomUUID(), "9999", "Nowhere", AccountType.ASSET, "USD");
        ValidationResult unknown = validator.validate(entry(SourceType.MANUAL,
            line(stranger, Direction.DEBIT, "1.00"), line(revenue, Direction.CREDIT, "1.00")), accounts);
        assertEquals(ValidationFailure.UNKNOWN_ACCOUNT, unknown.getFailure());
        assertEquals(stranger.getId(), unknown.getAccountId());

        Account closed = revenue.deactivate();
        ValidationResult inactive = validator.validate(entry(SourceType.MANUAL,
            line(cash, Direction.DEBIT, "1.00"), line(closed, Direction.CREDIT, "1.00")),
            Map.of(cash.getId(), cash, closed.getId(), closed));
        assertEquals(ValidationFailure.INACTIVE_ACCOUNT, inactive.getFailure());
    }

    @Test
    @DisplayName("Foreign currency line without fx rate is refused")
    void testMissingFxRate() {
        ValidationResult result = validator.validate(entry(SourceType.MANUAL,
            JournalLine.of(cash.getId(), Direction.DEBIT, new BigDecimal("10.00"), "EUR"),
            line(revenue, Direction.CREDIT, "10.00")), accounts);
        assertEquals(ValidationFailure.MISSING_FX_RATE, result.getFailure());
    }

    @Test
    @DisplayName("Unconverted lines in two currencies are mixed currency")
    void testMixedCurrency() {
        ValidationResult result = validator.validate(entry(SourceType.MANUAL,
            line(euroCash, Direction.DEBIT, "10.00"), line(revenue, Direction.CREDIT, "10.00")), accounts);
        assertEquals(ValidationFailure.MIXED_CURRENCY, result.getFailure());
    }

    @Test
    @DisplayName("Manual entries may not touch clearing accounts, statement entries may")
    void testClearingRestricted() {
        JournalLine debit = line(clearing, Direction.DEBIT, "10.00");
        JournalLine credit = line(revenue, Direction.CREDIT, "10.00");

        assertEquals(ValidationFailure.CLEARING_ACCOUNT_RESTRICTED,
            validator.validate(entry(SourceType.MANUAL, debit, credit), accounts).getFailure());
        assertTrue(validator.validate(entry(SourceType.BANK_STATEMENT, debit, credit), accounts).isValid());
    }

    @Test
    @DisplayName("Validation is a pure function of entry and accounts")
    void testDeterministic() {
        JournalEntry entry = entry(SourceType.MANUAL,
            line(cash, Direction.DEBIT, "3.00"), line(revenue, Direction.CREDIT, "2.00"));
        assertEquals(validator.validate(entry, accounts), validator.validate(entry, accounts));
    }

    private JournalLine line(Account account, Direction direction, String amount) {
        return JournalLine.of(account.getId(), direction, new BigDecimal(amount), account.getCurrency());
    }

    private JournalEntry entry(SourceType sourceType, JournalLine... lines) {
        return JournalEntry.draft(UUID.randomUUID(), LocalDate.of(2024, 3, 15), "test", sourceType, List.of(lines));
    }
}
