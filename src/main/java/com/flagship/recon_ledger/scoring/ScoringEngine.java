package com.flagship.recon_ledger.scoring;

import com.flagship.recon_ledger.ledger.AccountType;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.statement.BankTransaction;
import com.flagship.recon_ledger.statement.TransactionDirection;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scores how well a set of journal entries explains a bank transaction.
 *
 * Five dimensions (amount, date, description, business fit, history), each 0..100, are
 * combined with the configured weights and rounded HALF_UP to an integer. Stateless: the
 * same inputs always produce the same score and breakdown.
 */
public class ScoringEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100).setScale(4);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(4);

    private static final BigDecimal AMOUNT_EXACT = HUNDRED;
    private static final BigDecimal AMOUNT_IN_BAND = BigDecimal.valueOf(90).setScale(4);
    private static final BigDecimal AGGREGATE_EXACT = BigDecimal.valueOf(70).setScale(4);
    private static final BigDecimal AGGREGATE_IN_BAND = BigDecimal.valueOf(65).setScale(4);
    private static final BigDecimal AMOUNT_DECAY_CAP = BigDecimal.valueOf(60);
    private static final BigDecimal AMOUNT_DECAY_SPAN = new BigDecimal("0.25");

    private static final BigDecimal DATE_NEAR = BigDecimal.valueOf(90).setScale(4);
    private static final BigDecimal DATE_IN_WINDOW = BigDecimal.valueOf(70).setScale(4);
    private static final int DATE_TAIL_START = 30;
    private static final int DATE_TAIL_STEP = 3;

    private final ScoringConfig config;
    private final PlausibilityTable plausibility;
    private final CandidateSetGenerator setGenerator;

    public ScoringEngine(ScoringConfig config, PlausibilityTable plausibility) {
        this.config = config;
        this.plausibility = plausibility;
        this.setGenerator = new CandidateSetGenerator(config);
    }

    public ScoringConfig getConfig() {
        return config;
    }

    /**
     * Scores one candidate set.
     */
    public MatchScore score(BankTransaction transaction, List<CandidateEntry> entries, MatchHistory history) {
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Cannot score an empty candidate set");
        }

        BigDecimal amount = scoreAmount(transaction.getAmount(), entries);
        BigDecimal date = scoreDate(transaction, entries);
        BigDecimal description = scoreDescription(transaction, entries);
        BigDecimal businessFit = scoreBusinessFit(transaction, entries);
        HistoryScorer.Result historyResult = HistoryScorer.score(
            transaction.getAmount(), transaction.getTxnDate(), history, config);

        BigDecimal composite = config.getAmountWeight().multiply(amount)
            .add(config.getDateWeight().multiply(date))
            .add(config.getDescriptionWeight().multiply(description))
            .add(config.getBusinessFitWeight().multiply(businessFit))
            .add(config.getHistoryWeight().multiply(historyResult.getScore()));
        int rounded = composite.max(BigDecimal.ZERO).min(BigDecimal.valueOf(100))
            .setScale(0, RoundingMode.HALF_UP)
            .intValueExact();

        ScoreBreakdown breakdown = new ScoreBreakdown(amount, date, description, businessFit,
            historyResult.getScore(), historyResult.isDeviation(), entries.size());
        return new MatchScore(rounded, breakdown, List.copyOf(entries));
    }

    /**
     * Best-scoring candidate set, skipping sets for which {@code excluded} holds.
     * Ties go to fewer entries, then the earlier earliest date, then entry ids.
     */
    public Optional<MatchScore> best(BankTransaction transaction, List<CandidateEntry> candidates,
                                     MatchHistory history, Predicate<Set<UUID>> excluded) {
        List<MatchScore> scored = new ArrayList<>();
        for (List<CandidateEntry> set : setGenerator.generate(transaction.getAmount(), candidates)) {
            Set<UUID> ids = set.stream().map(CandidateEntry::getEntryId).collect(Collectors.toSet());
            if (excluded.test(ids)) {
                continue;
            }
            scored.add(score(transaction, set, history));
        }
        return scored.stream().min(MatchScore.BEST_FIRST);
    }

    BigDecimal scoreAmount(BigDecimal transactionAmount, List<CandidateEntry> entries) {
        BigDecimal total = entries.stream().map(CandidateEntry::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal difference = transactionAmount.subtract(total).abs();
        boolean aggregate = entries.size() > 1;

        if (difference.signum() == 0) {
            return aggregate ? AGGREGATE_EXACT : AMOUNT_EXACT;
        }
        if (difference.compareTo(config.feeBand(transactionAmount)) <= 0) {
            return aggregate ? AGGREGATE_IN_BAND : AMOUNT_IN_BAND;
        }

        BigDecimal relative = difference.divide(transactionAmount, 8, RoundingMode.HALF_UP);
        BigDecimal remaining = BigDecimal.ONE.subtract(relative.divide(AMOUNT_DECAY_SPAN, 8, RoundingMode.HALF_UP))
            .max(BigDecimal.ZERO);
        return AMOUNT_DECAY_CAP.multiply(remaining).setScale(4, RoundingMode.HALF_UP);
    }

    /**
     * Worst entry wins: a set is only as close in time as its furthest entry.
     */
    BigDecimal scoreDate(BankTransaction transaction, List<CandidateEntry> entries) {
        return entries.stream()
            .map(e -> dateScore(Math.abs(ChronoUnit.DAYS.between(transaction.getTxnDate(), e.getEntryDate()))))
            .min(Comparator.naturalOrder())
            .orElse(ZERO);
    }

    BigDecimal dateScore(long days) {
        if (days == 0) {
            return HUNDRED;
        }
        if (days <= config.getDateNearDays()) {
            return DATE_NEAR;
        }
        if (days <= config.getDateWindowDays()) {
            return DATE_IN_WINDOW;
        }
        long tail = DATE_TAIL_START - DATE_TAIL_STEP * (days - config.getDateWindowDays());
        return BigDecimal.valueOf(Math.max(0, tail)).setScale(4);
    }

    /**
     * Best entry wins, over every pairing of {description, reference} with {memo, each tag, all tags}.
     */
    BigDecimal scoreDescription(BankTransaction transaction, List<CandidateEntry> entries) {
        List<String> sides = Stream.of(transaction.getDescription(), transaction.getReference())
            .filter(s -> s != null && !s.isBlank())
            .toList();

        BigDecimal best = ZERO;
        for (CandidateEntry entry : entries) {
            List<String> targets = new ArrayList<>();
            if (entry.getMemo() != null) {
                targets.add(entry.getMemo());
            }
            targets.addAll(entry.getTags());
            if (entry.getTags().size() > 1) {
                targets.add(String.join(" ", entry.getTags()));
            }
            for (String side : sides) {
                for (String target : targets) {
                    best = best.max(DescriptionSimilarity.similarity(side, target));
                }
            }
        }
        return best;
    }

    /**
     * Minimum over the set: one implausible entry makes the whole set implausible.
     */
    BigDecimal scoreBusinessFit(BankTransaction transaction, List<CandidateEntry> entries) {
        return entries.stream()
            .map(e -> businessFit(transaction, e))
            .min(Comparator.naturalOrder())
            .orElse(ZERO);
    }

    private BigDecimal businessFit(BankTransaction transaction, CandidateEntry entry) {
        UUID source = transaction.getSourceAccountId();
        Direction expected = transaction.getDirection() == TransactionDirection.IN ? Direction.DEBIT : Direction.CREDIT;
        if (entry.touches(source, expected.opposite()) && !entry.touches(source, expected)) {
            return plausibility.wrongSide();
        }

        List<CandidateLine> counterparts = entry.getLines().stream()
            .filter(l -> !l.getAccountId().equals(source))
            .toList();
        if (counterparts.isEmpty()) {
            return plausibility.fallback();
        }

        List<AccountType> nonAssetTypes = counterparts.stream()
            .map(CandidateLine::getAccountType)
            .filter(t -> t != AccountType.ASSET)
            .distinct()
            .toList();
        if (nonAssetTypes.isEmpty()) {
            boolean viaClearing = counterparts.stream().anyMatch(CandidateLine::isClearing);
            return viaClearing ? plausibility.assetViaClearing() : plausibility.assetOnly();
        }

        return nonAssetTypes.stream()
            .map(t -> plausibility.lookup(transaction.getDirection(), t))
            .max(Comparator.naturalOrder())
            .orElse(plausibility.fallback());
    }
}
