package com.flagship.recon_ledger.scoring;

import com.flagship.recon_ledger.ledger.Account;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.ledger.EntryStatus;
import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.ledger.JournalLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A journal entry as seen by the scoring engine.
 *
 * {@code amount} is the sum of the entry's DEBIT lines in ledger amounts.
 */
@Value
public class CandidateEntry {
    UUID entryId;
    LocalDate entryDate;
    String memo;
    List<String> tags;
    EntryStatus status;
    BigDecimal amount;
    List<CandidateLine> lines;

    public static CandidateEntry from(JournalEntry entry, Map<UUID, Account> accounts, Set<UUID> clearingAccountIds) {
        List<CandidateLine> lines = new ArrayList<>();
        Set<String> tags = new LinkedHashSet<>();
        for (JournalLine line : entry.getLines()) {
            Account account = accounts.get(line.getAccountId());
            if (account == null) {
                throw new IllegalStateException("Account " + line.getAccountId() + " of entry "
                    + entry.getId() + " not loaded");
            }
            lines.add(new CandidateLine(line.getAccountId(), account.getType(), line.getDirection(),
                line.ledgerAmount(), clearingAccountIds.contains(line.getAccountId())));
            if (line.getTags() != null) {
                tags.addAll(line.getTags());
            }
            if (line.getEventType() != null) {
                tags.add(line.getEventType());
            }
        }
        return new CandidateEntry(entry.getId(), entry.getEntryDate(), entry.getMemo(), List.copyOf(tags),
            entry.getStatus(), entry.totalDebits(), List.copyOf(lines));
    }

    public boolean isDraft() {
        return status == EntryStatus.DRAFT;
    }

    public boolean touches(UUID accountId, Direction direction) {
        return lines.stream().anyMatch(l -> l.getAccountId().equals(accountId) && l.getDirection() == direction);
    }
}
