package com.flagship.recon_ledger.config;

import com.flagship.recon_ledger.consistency.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Tunable settings of the reconciliation engine (reconciliation.*).
 *
 * Thresholds here are the global defaults; per-account overrides live in the
 * threshold_overrides table and win when present.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    @Valid
    private Thresholds thresholds = new Thresholds();

    @Valid
    private Weights weights = new Weights();

    @Valid
    private Tolerances tolerances = new Tolerances();

    @Valid
    private Candidates candidates = new Candidates();

    @Valid
    private Consistency consistency = new Consistency();

    /**
     * Clearing (processing) accounts used to park in-transit transfers.
     */
    private Set<UUID> clearingAccountIds = new LinkedHashSet<>();

    /**
     * When true, aggregate (multi-entry) matches never auto-accept.
     */
    private boolean requireReviewForMultiEntry = false;

    /**
     * Start a matcher run for the statement's account right after ingestion.
     */
    private boolean autoRunOnIngest = true;

    @Data
    public static class Thresholds {
        @Min(0)
        @Max(100)
        private int autoAccept = 85;

        @Min(0)
        @Max(100)
        private int reviewFloor = 60;
    }

    @Data
    public static class Weights {
        @NotNull
        private BigDecimal amount = new BigDecimal("0.40");
        @NotNull
        private BigDecimal date = new BigDecimal("0.25");
        @NotNull
        private BigDecimal description = new BigDecimal("0.20");
        @NotNull
        private BigDecimal businessFit = new BigDecimal("0.10");
        @NotNull
        private BigDecimal history = new BigDecimal("0.05");
    }

    @Data
    public static class Tolerances {
        @NotNull
        @DecimalMin("0")
        private BigDecimal feeTolerancePercent = new BigDecimal("0.005");

        @NotNull
        @DecimalMin("0")
        private BigDecimal feeToleranceAbsolute = new BigDecimal("0.10");

        @Min(0)
        private int dateNearDays = 3;

        @Min(0)
        private int dateWindowDays = 7;
    }

    @Data
    public static class Candidates {
        /**
         * Entries further than this from the transaction date are not considered at all.
         */
        @Min(0)
        private int windowDays = 14;

        @Min(1)
        @Max(5)
        private int maxCombinationSize = 3;

        @Min(0)
        private int maxCombinationCandidates = 30;
    }

    @Data
    public static class Consistency {
        @NotNull
        private Duration staleReviewAge = Duration.ofDays(7);

        @Min(0)
        private int transferWindowDays = 3;

        /**
         * How far back the duplicate-transaction scan looks.
         */
        @Min(1)
        private int lookbackDays = 90;

        @NotNull
        private Severity blockingSeverity = Severity.MEDIUM;

        private boolean scheduleEnabled = true;

        private long scheduleMs = 300_000L;
    }
}
