package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.ledger.EntryStatus;
import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.ledger.JournalLine;
import com.flagship.recon_ledger.ledger.SourceType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("memo")
    String memo;

    @JsonProperty("source_type")
    SourceType sourceType;

    @JsonProperty("status")
    EntryStatus status;

    @JsonProperty("version")
    long version;

    @JsonProperty("total_debits")
    BigDecimal totalDebits;

    @JsonProperty("total_credits")
    BigDecimal totalCredits;

    @JsonProperty("reversal_of_entry_id")
    UUID reversalOfEntryId;

    @JsonProperty("reversed_by_entry_id")
    UUID reversedByEntryId;

    @JsonProperty("void_reason")
    String voidReason;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("lines")
    List<Line> lines;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .entryDate(entry.getEntryDate())
            .memo(entry.getMemo())
            .sourceType(entry.getSourceType())
            .status(entry.getStatus())
            .version(entry.getVersion())
            .totalDebits(entry.totalDebits())
            .totalCredits(entry.totalCredits())
            .reversalOfEntryId(entry.getReversalOfEntryId())
            .reversedByEntryId(entry.getReversedByEntryId())
            .voidReason(entry.getVoidReason())
            .postedAt(entry.getPostedAt())
            .lines(entry.getLines().stream().map(Line::from).toList())
            .build();
    }

    @Value
    public static class Line {
        @JsonProperty("id")
        UUID id;
        @JsonProperty("account_id")
        UUID accountId;
        @JsonProperty("direction")
        Direction direction;
        @JsonProperty("amount")
        BigDecimal amount;
        @JsonProperty("currency")
        String currency;
        @JsonProperty("fx_rate")
        BigDecimal fxRate;
        @JsonProperty("event_type")
        String eventType;
        @JsonProperty("tags")
        List<String> tags;

        static Line from(JournalLine line) {
            return new Line(line.getId(), line.getAccountId(), line.getDirection(), line.getAmount(),
                line.getCurrency(), line.getFxRate(), line.getEventType(), line.getTags());
        }
    }
}
