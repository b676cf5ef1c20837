package com.flagship.recon_ledger.routing;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.ledger.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Resolves the thresholds in force for an account: its override row if there is one,
 * otherwise the configured defaults. Overrides take effect on the next routing decision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThresholdPolicyService {

    private final ThresholdOverrideRepository overrideRepository;
    private final AccountRepository accountRepository;
    private final ReconciliationProperties properties;

    @Transactional(readOnly = true)
    public Thresholds thresholdsFor(UUID accountId) {
        return overrideRepository.findById(accountId)
            .map(ThresholdOverrideEntity::toThresholds)
            .orElseGet(this::defaults);
    }

    @Transactional(readOnly = true)
    public boolean hasOverride(UUID accountId) {
        return overrideRepository.existsById(accountId);
    }

    public Thresholds defaults() {
        ReconciliationProperties.Thresholds t = properties.getThresholds();
        return new Thresholds(t.getAutoAccept(), t.getReviewFloor());
    }

    @Transactional
    public Thresholds setOverride(UUID accountId, int autoAccept, int reviewFloor) {
        if (!accountRepository.existsById(accountId)) {
            throw new NotFoundException("Account", accountId);
        }
        Thresholds thresholds = new Thresholds(autoAccept, reviewFloor);
        ThresholdOverrideEntity entity = overrideRepository.findById(accountId)
            .orElseGet(() -> ThresholdOverrideEntity.of(accountId, thresholds));
        entity.apply(thresholds);
        overrideRepository.save(entity);
        log.info("Threshold override set: accountId={}, autoAccept={}, reviewFloor={}",
            accountId, autoAccept, reviewFloor);
        return thresholds;
    }

    @Transactional
    public void clearOverride(UUID accountId) {
        if (!overrideRepository.existsById(accountId)) {
            throw new NotFoundException("ThresholdOverride", accountId);
        }
        overrideRepository.deleteById(accountId);
        log.info("Threshold override cleared: accountId={}", accountId);
    }
}
