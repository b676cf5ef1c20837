package com.flagship.recon_ledger.scoring;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Weights and tolerances for one scoring pass. Weights must sum to exactly 1.
 */
@Value
public class ScoringConfig {
    BigDecimal amountWeight;
    BigDecimal dateWeight;
    BigDecimal descriptionWeight;
    BigDecimal businessFitWeight;
    BigDecimal historyWeight;
    BigDecimal feeTolerancePercent;
    BigDecimal feeToleranceAbsolute;
    int dateNearDays;
    int dateWindowDays;
    int maxCombinationSize;
    int maxCombinationCandidates;

    public ScoringConfig(BigDecimal amountWeight, BigDecimal dateWeight, BigDecimal descriptionWeight,
                         BigDecimal businessFitWeight, BigDecimal historyWeight,
                         BigDecimal feeTolerancePercent, BigDecimal feeToleranceAbsolute,
                         int dateNearDays, int dateWindowDays,
                         int maxCombinationSize, int maxCombinationCandidates) {
        BigDecimal sum = amountWeight.add(dateWeight).add(descriptionWeight).add(businessFitWeight).add(historyWeight);
        if (sum.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalArgumentException("Scoring weights must sum to 1, got " + sum.toPlainString());
        }
        if (dateNearDays < 0 || dateWindowDays < dateNearDays) {
            throw new IllegalArgumentException("Require 0 <= date-near-days <= date-window-days");
        }
        if (maxCombinationSize < 1) {
            throw new IllegalArgumentException("max-combination-size must be at least 1");
        }
        this.amountWeight = amountWeight;
        this.dateWeight = dateWeight;
        this.descriptionWeight = descriptionWeight;
        this.businessFitWeight = businessFitWeight;
        this.historyWeight = historyWeight;
        this.feeTolerancePercent = feeTolerancePercent;
        this.feeToleranceAbsolute = feeToleranceAbsolute;
        this.dateNearDays = dateNearDays;
        this.dateWindowDays = dateWindowDays;
        this.maxCombinationSize = maxCombinationSize;
        this.maxCombinationCandidates = maxCombinationCandidates;
    }

    public static ScoringConfig defaults() {
        return from(new ReconciliationProperties());
    }

    public static ScoringConfig from(ReconciliationProperties properties) {
        ReconciliationProperties.Weights w = properties.getWeights();
        ReconciliationProperties.Tolerances t = properties.getTolerances();
        ReconciliationProperties.Candidates c = properties.getCandidates();
        return new ScoringConfig(w.getAmount(), w.getDate(), w.getDescription(), w.getBusinessFit(), w.getHistory(),
            t.getFeeTolerancePercent(), t.getFeeToleranceAbsolute(), t.getDateNearDays(), t.getDateWindowDays(),
            c.getMaxCombinationSize(), c.getMaxCombinationCandidates());
    }

    /**
     * Absolute amount difference still treated as "same amount, fees aside".
     */
    public BigDecimal feeBand(BigDecimal amount) {
        BigDecimal relative = amount.abs().multiply(feeTolerancePercent).setScale(4, RoundingMode.HALF_UP);
        return relative.max(feeToleranceAbsolute);
    }
}
