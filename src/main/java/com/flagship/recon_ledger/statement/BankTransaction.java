package com.flagship.recon_ledger.statement;

import com.flagship.recon_ledger.ledger.JournalLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A transaction as reported by the bank or broker statement.
 *
 * Read-only to the matching engine apart from its status. {@code lowTrust} is set
 * when the statement it came from failed its balance check.
 */
@Value
public class BankTransaction {
    UUID id;
    UUID batchId;
    UUID sourceAccountId;
    LocalDate txnDate;
    BigDecimal amount;
    TransactionDirection direction;
    String description;
    String reference;
    String currency;
    BankTransactionStatus status;
    boolean lowTrust;
    long version;
    Instant createdAt;
    Instant updatedAt;

    public static BankTransaction create(UUID batchId, UUID sourceAccountId, LocalDate txnDate, BigDecimal amount,
                                         TransactionDirection direction, String description, String reference,
                                         String currency, boolean lowTrust) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Transaction amount must be positive: " + amount);
        }
        if (amount.stripTrailingZeros().scale() > JournalLine.AMOUNT_SCALE) {
            throw new IllegalArgumentException("Transaction amount " + amount.toPlainString()
                + " has more than " + JournalLine.AMOUNT_SCALE + " decimal places");
        }
        if (txnDate == null || direction == null) {
            throw new IllegalArgumentException("Transaction date and direction are required");
        }
        Instant now = Instant.now();
        return new BankTransaction(UUID.randomUUID(), batchId, sourceAccountId, txnDate, amount, direction,
            description, reference, currency, BankTransactionStatus.PENDING, lowTrust, 0L, now, now);
    }

    public BankTransaction withStatus(BankTransactionStatus newStatus) {
        return new BankTransaction(id, batchId, sourceAccountId, txnDate, amount, direction, description,
            reference, currency, newStatus, lowTrust, version, createdAt, Instant.now());
    }

    public boolean isMatched() {
        return status == BankTransactionStatus.MATCHED;
    }

    /**
     * Signed amount: positive for IN, negative for OUT.
     */
    public BigDecimal signedAmount() {
        return direction == TransactionDirection.IN ? amount : amount.negate();
    }
}
