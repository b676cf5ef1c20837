package com.flagship.recon_ledger.observability;

import com.flagship.recon_ledger.consistency.CheckStatus;
import com.flagship.recon_ledger.consistency.ConsistencyCheckRepository;
import com.flagship.recon_ledger.matching.MatchRepository;
import com.flagship.recon_ledger.matching.MatchStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Sizes of the human work queues: matches waiting for review and unresolved checks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueueMetrics {

    private final MatchRepository matchRepository;
    private final ConsistencyCheckRepository checkRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicLong pendingReview = new AtomicLong(0);
    private final AtomicLong pendingChecks = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("reconciliation.review.pending", pendingReview, AtomicLong::get)
            .description("Matches waiting for review")
            .register(meterRegistry);
        Gauge.builder("consistency.checks.pending", pendingChecks, AtomicLong::get)
            .description("Unresolved consistency checks")
            .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        pendingReview.set(matchRepository.countByStatus(MatchStatus.PENDING_REVIEW));
        pendingChecks.set(checkRepository.countByStatus(CheckStatus.PENDING));
        log.debug("Queue metrics refreshed: pendingReview={}, pendingChecks={}", pendingReview.get(), pendingChecks.get());
    }

    public long getPendingReview() {
        return pendingReview.get();
    }

    public long getPendingChecks() {
        return pendingChecks.get();
    }
}
