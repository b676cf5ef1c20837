package com.flagship.recon_ledger.consistency;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "reconciliation.consistency.schedule-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ConsistencyScheduler {

    private final ConsistencyChecker checker;

    @Scheduled(fixedDelayString = "${reconciliation.consistency.schedule-ms:300000}",
        initialDelayString = "${reconciliation.consistency.schedule-ms:300000}")
    public void runScheduledChecks() {
        try {
            checker.runChecks();
        } catch (RuntimeException e) {
            log.error("Scheduled consistency pass failed", e);
        }
    }
}
