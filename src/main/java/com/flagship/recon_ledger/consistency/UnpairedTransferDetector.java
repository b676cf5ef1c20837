package com.flagship.recon_ledger.consistency;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import com.flagship.recon_ledger.ledger.Direction;
import com.flagship.recon_ledger.ledger.JournalLineEntity;
import com.flagship.recon_ledger.ledger.JournalLineRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Transfer legs on a clearing account that never met their counterpart.
 *
 * A leg pairs with the earliest unpaired leg of opposite direction and equal ledger
 * amount on the same clearing account, within the transfer window. Legs still inside
 * the window are given time to pair. Older than twice the window is HIGH severity.
 */
@Component
@RequiredArgsConstructor
public class UnpairedTransferDetector implements ConsistencyDetector {

    private final JournalLineRepository lineRepository;
    private final ReconciliationProperties properties;
    private final Clock clock;

    @Override
    public CheckType type() {
        return CheckType.UNPAIRED_TRANSFER;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DetectedIssue> detect() {
        Set<UUID> clearing = properties.getClearingAccountIds();
        if (clearing.isEmpty()) {
            return List.of();
        }

        List<Leg> legs = lineRepository.findReportableLines(clearing).stream()
            .map(UnpairedTransferDetector::toLeg)
            .toList();
        return findUnpaired(legs, properties.getConsistency().getTransferWindowDays(), LocalDate.now(clock));
    }

    @Value
    static class Leg {
        UUID lineId;
        UUID entryId;
        UUID accountId;
        LocalDate date;
        Direction direction;
        BigDecimal amount;
    }

    private static Leg toLeg(JournalLineEntity line) {
        return new Leg(line.getId(), line.getEntry().getId(), line.getAccountId(), line.getEntry().getEntryDate(),
            line.getDirection(), line.toDomain().ledgerAmount());
    }

    /**
     * Legs must be ordered by date.
     */
    static List<DetectedIssue> findUnpaired(List<Leg> legs, int windowDays, LocalDate today) {
        Set<UUID> paired = new HashSet<>();
        for (int i = 0; i < legs.size(); i++) {
            Leg leg = legs.get(i);
            if (paired.contains(leg.getLineId())) {
                continue;
            }
            for (int j = i + 1; j < legs.size(); j++) {
                Leg other = legs.get(j);
                if (ChronoUnit.DAYS.between(leg.getDate(), other.getDate()) > windowDays) {
                    break;
                }
                if (!paired.contains(other.getLineId())
                        && other.getAccountId().equals(leg.getAccountId())
                        && other.getDirection() != leg.getDirection()
                        && other.getAmount().compareTo(leg.getAmount()) == 0) {
                    paired.add(leg.getLineId());
                    paired.add(other.getLineId());
                    break;
                }
            }
        }

        List<DetectedIssue> issues = new ArrayList<>();
        for (Leg leg : legs) {
            long age = ChronoUnit.DAYS.between(leg.getDate(), today);
            if (paired.contains(leg.getLineId()) || age <= windowDays) {
                continue;
            }
            Severity severity = age > 2L * windowDays ? Severity.HIGH : Severity.MEDIUM;
            issues.add(new DetectedIssue(CheckType.UNPAIRED_TRANSFER, severity,
                List.of(CheckSubject.line(leg.getLineId()), CheckSubject.entry(leg.getEntryId())),
                Map.of("clearing_account_id", leg.getAccountId().toString(),
                    "direction", leg.getDirection().name(),
                    "amount", leg.getAmount().toPlainString(),
                    "age_days", age)));
        }
        return issues;
    }
}
