package com.flagship.recon_ledger.statement;

import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class IngestionResult {
    StatementBatch batch;
    List<UUID> transactionIds;
}
