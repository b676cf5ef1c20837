package com.flagship.recon_ledger.statement;

import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.scoring.CandidateEntry;

import java.util.List;
import java.util.UUID;

/**
 * Supplies the matcher with transactions to match and the ledger entries they could match.
 */
public interface CandidateSource {

    /**
     * PENDING and UNMATCHED transactions in scope, oldest first.
     */
    List<UUID> transactionsToMatch(ReconciliationScope scope);

    /**
     * POSTED or DRAFT, non-reversed entries within the candidate window of the transaction date.
     */
    List<CandidateEntry> candidatesFor(BankTransaction transaction);

    /**
     * The given entries in scoring form, for sets chosen by hand rather than searched for.
     */
    List<CandidateEntry> asCandidates(List<JournalEntry> entries);
}
