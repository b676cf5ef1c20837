package com.flagship.recon_ledger.exception;

import com.flagship.recon_ledger.ledger.ValidationFailure;
import com.flagship.recon_ledger.ledger.ValidationResult;

/**
 * A journal entry failed validation. Never retried: the caller has to change the entry.
 */
public class LedgerValidationException extends RuntimeException {

    private final ValidationResult result;

    public LedgerValidationException(ValidationResult result) {
        super(result.getMessage());
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }

    public ValidationFailure getFailure() {
        return result.getFailure();
    }
}
