package com.flagship.recon_ledger.scoring;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Enumerates the entry sets worth scoring for one transaction amount.
 *
 * Every single entry is a set. Combinations of 2..maxCombinationSize entries are added only
 * when their total lands within the fee band, drawn from the maxCombinationCandidates entries
 * closest in amount. Output order is deterministic.
 */
final class CandidateSetGenerator {

    private final ScoringConfig config;

    CandidateSetGenerator(ScoringConfig config) {
        this.config = config;
    }

    List<List<CandidateEntry>> generate(BigDecimal amount, List<CandidateEntry> candidates) {
        List<CandidateEntry> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator
            .comparing((CandidateEntry c) -> c.getAmount().subtract(amount).abs())
            .thenComparing(CandidateEntry::getEntryDate)
            .thenComparing(CandidateEntry::getEntryId));

        List<List<CandidateEntry>> sets = new ArrayList<>();
        for (CandidateEntry candidate : ordered) {
            sets.add(List.of(candidate));
        }

        if (config.getMaxCombinationSize() < 2 || ordered.size() < 2) {
            return sets;
        }

        BigDecimal band = config.feeBand(amount);
        BigDecimal ceiling = amount.add(band);
        List<CandidateEntry> pool = ordered.stream()
            .filter(c -> c.getAmount().signum() > 0 && c.getAmount().compareTo(ceiling) <= 0)
            .limit(config.getMaxCombinationCandidates())
            .toList();

        combine(pool, 0, new ArrayList<>(), BigDecimal.ZERO, amount, band, sets);
        return sets;
    }

    private void combine(List<CandidateEntry> pool, int start, List<CandidateEntry> current, BigDecimal total,
                         BigDecimal amount, BigDecimal band, List<List<CandidateEntry>> out) {
        if (current.size() >= 2 && total.subtract(amount).abs().compareTo(band) <= 0) {
            out.add(List.copyOf(current));
        }
        if (current.size() == config.getMaxCombinationSize()) {
            return;
        }
        for (int i = start; i < pool.size(); i++) {
            BigDecimal next = total.add(pool.get(i).getAmount());
            if (next.compareTo(amount.add(band)) > 0) {
                continue;
            }
            current.add(pool.get(i));
            combine(pool, i + 1, current, next, amount, band, out);
            current.remove(current.size() - 1);
        }
    }
}
