package com.flagship.recon_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * One debit or credit leg of a journal entry.
 *
 * {@code amount} is in the line's own currency. When {@code fxRate} is present the
 * ledger amount is {@code amount * fxRate}; balance checks always use ledger amounts.
 */
@Value
public class JournalLine {

    /**
     * Decimal places the ledger stores for line amounts.
     */
    public static final int AMOUNT_SCALE = 4;

    UUID id;
    UUID accountId;
    Direction direction;
    BigDecimal amount;
    String currency;
    BigDecimal fxRate;
    String eventType;
    List<String> tags;

    public static JournalLine of(UUID accountId, Direction direction, BigDecimal amount, String currency) {
        return create(accountId, direction, amount, currency, null, null, List.of());
    }

    public static JournalLine create(UUID accountId, Direction direction, BigDecimal amount, String currency,
                                     BigDecimal fxRate, String eventType, List<String> tags) {
        if (accountId == null) {
            throw new IllegalArgumentException("Account id is required");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Direction is required");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative: " + amount);
        }
        if (amount.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new IllegalArgumentException(
                "Amount " + amount.toPlainString() + " has more than " + AMOUNT_SCALE + " decimal places");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        return new JournalLine(
            UUID.randomUUID(),
            accountId,
            direction,
            amount,
            currency,
            fxRate,
            eventType,
            tags == null ? List.of() : List.copyOf(tags)
        );
    }

    public BigDecimal ledgerAmount() {
        return fxRate == null ? amount : amount.multiply(fxRate);
    }

    public boolean isDebit() {
        return direction == Direction.DEBIT;
    }

    /**
     * Same account and amount on the opposite side, as a new line.
     */
    public JournalLine reversed() {
        return new JournalLine(
            UUID.randomUUID(),
            accountId,
            direction.opposite(),
            amount,
            currency,
            fxRate,
            eventType,
            tags
        );
    }
}
