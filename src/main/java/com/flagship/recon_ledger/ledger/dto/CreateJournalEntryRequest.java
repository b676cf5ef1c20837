package com.flagship.recon_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recon_ledger.ledger.SourceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class CreateJournalEntryRequest {

    @NotNull(message = "Entry date is required")
    @JsonProperty("entry_date")
    LocalDate entryDate;

    @Size(max = 500)
    @JsonProperty("memo")
    String memo;

    @JsonProperty("source_type")
    SourceType sourceType;

    @NotNull(message = "Lines are required")
    @Valid
    @JsonProperty("lines")
    List<JournalLineRequest> lines;
}
