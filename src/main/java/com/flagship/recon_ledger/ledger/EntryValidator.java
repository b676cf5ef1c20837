package com.flagship.recon_ledger.ledger;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Validates journal entries against the posting rules.
 *
 * Pure: accounts are passed in, so the same entry and accounts always give the same result.
 * Checks run in a fixed order and the first failure wins; the balance check runs last
 * so an imbalance is only reported for otherwise well-formed entries.
 */
@Component
public class EntryValidator {

    private final ReconciliationProperties properties;

    public EntryValidator(ReconciliationProperties properties) {
        this.properties = properties;
    }

    /**
     * Full validation as required for posting.
     */
    public ValidationResult validate(JournalEntry entry, Map<UUID, Account> accounts) {
        if (entry.getLines().size() < 2) {
            return ValidationResult.failed(ValidationFailure.TOO_FEW_LINES,
                String.format("Entry needs at least 2 lines, has %d", entry.getLines().size()));
        }

        ValidationResult structural = validateLines(entry.getSourceType(), entry.getLines(), accounts);
        if (!structural.isValid()) {
            return structural;
        }

        if (!entry.isBalanced()) {
            return ValidationResult.imbalanced(entry.totalDebits(), entry.totalCredits());
        }
        return ValidationResult.ok();
    }

    /**
     * Line-level checks only. Used when saving drafts, which may be incomplete or unbalanced.
     */
    public ValidationResult validateLines(SourceType sourceType, List<JournalLine> lines, Map<UUID, Account> accounts) {
        Set<String> unconvertedCurrencies = new TreeSet<>();
        Set<UUID> clearingAccounts = properties.getClearingAccountIds();

        for (JournalLine line : lines) {
            Account account = accounts.get(line.getAccountId());
            if (account == null) {
                return ValidationResult.failed(ValidationFailure.UNKNOWN_ACCOUNT,
                    "Account not found: " + line.getAccountId(), line.getAccountId());
            }
            if (!account.isActive()) {
                return ValidationResult.failed(ValidationFailure.INACTIVE_ACCOUNT,
                    "Account " + account.getCode() + " is inactive", account.getId());
            }
            if (line.getAmount().signum() <= 0) {
                return ValidationResult.failed(ValidationFailure.NON_POSITIVE_AMOUNT,
                    "Line amounts must be positive, got " + line.getAmount().toPlainString()
                        + " on account " + account.getCode(), account.getId());
            }
            if (line.getFxRate() != null && line.getFxRate().signum() <= 0) {
                return ValidationResult.failed(ValidationFailure.INVALID_FX_RATE,
                    "fx_rate must be positive on account " + account.getCode(), account.getId());
            }
            if (line.getFxRate() == null) {
                if (!line.getCurrency().equals(account.getCurrency())) {
                    return ValidationResult.failed(ValidationFailure.MISSING_FX_RATE,
                        String.format("Line in %s on account %s (%s) requires an fx_rate",
                            line.getCurrency(), account.getCode(), account.getCurrency()), account.getId());
                }
                unconvertedCurrencies.add(line.getCurrency());
            }
            if (sourceType == SourceType.MANUAL && clearingAccounts.contains(account.getId())) {
                return ValidationResult.failed(ValidationFailure.CLEARING_ACCOUNT_RESTRICTED,
                    "Clearing account " + account.getCode() + " is reserved for statement and system entries",
                    account.getId());
            }
        }

        if (unconvertedCurrencies.size() > 1) {
            return ValidationResult.failed(ValidationFailure.MIXED_CURRENCY,
                "Lines without fx_rate use different currencies: " + unconvertedCurrencies);
        }
        return ValidationResult.ok();
    }
}
