package com.flagship.recon_ledger.statement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.statement.StatementExtraction;
import com.flagship.recon_ledger.statement.TransactionDirection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A structured statement extraction as submitted over REST or carried on the
 * statement-extractions topic.
 */
@Value
public class StatementSubmissionRequest {

    @NotNull(message = "Source account id is required")
    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("period_start")
    LocalDate periodStart;

    @JsonProperty("period_end")
    LocalDate periodEnd;

    @Digits(integer = 15, fraction = 4, message = "Opening balance allows at most 4 decimal places")
    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @Digits(integer = 15, fraction = 4, message = "Closing balance allows at most 4 decimal places")
    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    @Size(min = 3, max = 3)
    @JsonProperty("currency")
    String currency;

    @Size(max = 200)
    @JsonProperty("document_reference")
    String documentReference;

    @JsonProperty("extractor_balance_ok")
    Boolean extractorBalanceOk;

    @NotEmpty(message = "At least one transaction is required")
    @Valid
    @JsonProperty("transactions")
    List<Line> transactions;

    @Value
    public static class Line {
        @NotNull(message = "Transaction date is required")
        @JsonProperty("txn_date")
        LocalDate txnDate;

        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0.01", message = "Amount must be positive")
        @Digits(integer = 15, fraction = 4, message = "Amount allows at most 4 decimal places")
        @JsonProperty("amount")
        BigDecimal amount;

        @NotNull(message = "Direction is required")
        @JsonProperty("direction")
        TransactionDirection direction;

        @Size(max = 500)
        @JsonProperty("description")
        String description;

        @Size(max = 200)
        @JsonProperty("reference")
        String reference;

        @Size(min = 3, max = 3)
        @JsonProperty("currency")
        String currency;
    }

    /**
     * A missing extractor verdict counts as a failed one.
     */
    public StatementExtraction toExtraction() {
        return new StatementExtraction(sourceAccountId, periodStart, periodEnd, openingBalance, closingBalance,
            currency, documentReference, Boolean.TRUE.equals(extractorBalanceOk),
            transactions.stream()
                .map(l -> new StatementExtraction.Line(l.getTxnDate(), l.getAmount(), l.getDirection(),
                    l.getDescription(), l.getReference(), l.getCurrency()))
                .toList());
    }
}
