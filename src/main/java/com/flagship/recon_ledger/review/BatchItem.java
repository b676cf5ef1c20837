package com.flagship.recon_ledger.review;

import lombok.Value;

import java.util.UUID;

@Value
public class BatchItem {
    UUID matchId;
    long version;
}
