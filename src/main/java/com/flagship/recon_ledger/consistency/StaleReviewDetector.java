package com.flagship.recon_ledger.consistency;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import com.flagship.recon_ledger.matching.MatchEntity;
import com.flagship.recon_ledger.matching.MatchRepository;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Matches left in the review queue too long. MEDIUM once twice the allowed age.
 */
@Component
@RequiredArgsConstructor
public class StaleReviewDetector implements ConsistencyDetector {

    private final MatchRepository matchRepository;
    private final ReconciliationProperties properties;
    private final Clock clock;

    @Override
    public CheckType type() {
        return CheckType.STALE_REVIEW;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DetectedIssue> detect() {
        Duration maxAge = properties.getConsistency().getStaleReviewAge();
        Instant now = clock.instant();
        return matchRepository.findByStatusAndCreatedAtBefore(MatchStatus.PENDING_REVIEW, now.minus(maxAge)).stream()
            .map(MatchEntity::toDomain)
            .map(match -> toIssue(match, now, maxAge))
            .toList();
    }

    static DetectedIssue toIssue(ReconciliationMatch match, Instant now, Duration maxAge) {
        Duration age = Duration.between(match.getCreatedAt(), now);
        Severity severity = age.compareTo(maxAge.multipliedBy(2)) > 0 ? Severity.MEDIUM : Severity.LOW;
        return new DetectedIssue(CheckType.STALE_REVIEW, severity,
            List.of(CheckSubject.match(match.getId()), CheckSubject.transaction(match.getBankTransactionId())),
            Map.of("age_hours", age.toHours(), "score", match.getScore()));
    }
}
