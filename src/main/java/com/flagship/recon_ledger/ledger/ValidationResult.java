package com.flagship.recon_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of validating a journal entry.
 *
 * For {@link ValidationFailure#IMBALANCED} the signed delta (debits - credits) and the
 * short side are populated: a positive delta means the CREDIT side is short.
 */
@Value
public class ValidationResult {
    boolean valid;
    ValidationFailure failure;
    String message;
    BigDecimal delta;
    Direction shortSide;
    UUID accountId;

    public static ValidationResult ok() {
        return new ValidationResult(true, null, "OK", null, null, null);
    }

    public static ValidationResult imbalanced(BigDecimal debits, BigDecimal credits) {
        BigDecimal delta = debits.subtract(credits);
        Direction shortSide = delta.signum() > 0 ? Direction.CREDIT : Direction.DEBIT;
        return new ValidationResult(
            false,
            ValidationFailure.IMBALANCED,
            String.format("Entry is not balanced: debits=%s, credits=%s, delta=%s (%s side short)",
                debits.toPlainString(), credits.toPlainString(), delta.toPlainString(), shortSide),
            delta,
            shortSide,
            null
        );
    }

    public static ValidationResult failed(ValidationFailure failure, String message) {
        return new ValidationResult(false, failure, message, null, null, null);
    }

    public static ValidationResult failed(ValidationFailure failure, String message, UUID accountId) {
        return new ValidationResult(false, failure, message, null, null, accountId);
    }
}
