package com.flagship.recon_ledger.scoring;

import lombok.Value;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Composite score of one candidate set against one bank transaction.
 */
@Value
public class MatchScore {
    int score;
    ScoreBreakdown breakdown;
    List<CandidateEntry> entries;

    public List<UUID> entryIds() {
        return entries.stream().map(CandidateEntry::getEntryId).sorted().toList();
    }

    public boolean isMultiEntry() {
        return entries.size() > 1;
    }

    public boolean containsDraft() {
        return entries.stream().anyMatch(CandidateEntry::isDraft);
    }

    public LocalDate earliestDate() {
        return entries.stream().map(CandidateEntry::getEntryDate).min(Comparator.naturalOrder()).orElseThrow();
    }

    /**
     * Best-first ordering: higher score, fewer entries, earlier date, then entry ids.
     */
    public static final Comparator<MatchScore> BEST_FIRST = Comparator
        .comparingInt(MatchScore::getScore).reversed()
        .thenComparingInt((MatchScore s) -> s.getEntries().size())
        .thenComparing(MatchScore::earliestDate)
        .thenComparing(s -> s.entryIds().toString());
}
