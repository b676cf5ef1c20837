package com.flagship.recon_ledger.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need database queries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final QueueMetrics queueMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshMetrics() {
        try {
            outboxMetrics.refreshMetrics();
            queueMetrics.refreshMetrics();
        } catch (RuntimeException e) {
            log.warn("Metrics refresh failed: {}", e.getMessage());
        }
    }
}
