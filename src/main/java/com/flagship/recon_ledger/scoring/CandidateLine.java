package com.flagship.recon_ledger.scoring;

import com.flagship.recon_ledger.ledger.AccountType;
import com.flagship.recon_ledger.ledger.Direction;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The parts of a journal line the scorer looks at.
 */
@Value
public class CandidateLine {
    UUID accountId;
    AccountType accountType;
    Direction direction;
    BigDecimal ledgerAmount;
    boolean clearing;
}
