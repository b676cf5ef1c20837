package com.flagship.recon_ledger.consistency;

import com.flagship.recon_ledger.matching.MatchEntity;
import com.flagship.recon_ledger.matching.MatchRepository;
import com.flagship.recon_ledger.matching.MatchStatus;
import com.flagship.recon_ledger.matching.ReconciliationMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A transaction, or a journal entry, that ended up in more than one confirmed match.
 */
@Component
@RequiredArgsConstructor
public class DuplicateMatchDetector implements ConsistencyDetector {

    private final MatchRepository matchRepository;

    @Override
    public CheckType type() {
        return CheckType.DUPLICATE_MATCH;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DetectedIssue> detect() {
        List<ReconciliationMatch> confirmed = matchRepository
            .findByStatusIn(EnumSet.of(MatchStatus.AUTO_ACCEPTED, MatchStatus.ACCEPTED)).stream()
            .map(MatchEntity::toDomain)
            .toList();

        Map<UUID, List<UUID>> byTransaction = new TreeMap<>();
        Map<UUID, List<UUID>> byEntry = new TreeMap<>();
        for (ReconciliationMatch match : confirmed) {
            byTransaction.computeIfAbsent(match.getBankTransactionId(), k -> new ArrayList<>()).add(match.getId());
            for (UUID entryId : match.getEntryIds()) {
                byEntry.computeIfAbsent(entryId, k -> new ArrayList<>()).add(match.getId());
            }
        }

        List<DetectedIssue> issues = new ArrayList<>();
        byTransaction.forEach((txnId, matchIds) -> {
            if (matchIds.size() > 1) {
                issues.add(issue(CheckSubject.transaction(txnId), matchIds, "transaction"));
            }
        });
        byEntry.forEach((entryId, matchIds) -> {
            if (matchIds.size() > 1) {
                issues.add(issue(CheckSubject.entry(entryId), matchIds, "entry"));
            }
        });
        return issues;
    }

    private DetectedIssue issue(CheckSubject shared, List<UUID> matchIds, String sharedKind) {
        List<CheckSubject> subjects = new ArrayList<>();
        subjects.add(shared);
        matchIds.forEach(id -> subjects.add(CheckSubject.match(id)));
        return new DetectedIssue(CheckType.DUPLICATE_MATCH, Severity.HIGH, subjects, Map.of(
            "shared", sharedKind,
            "shared_id", shared.getId().toString(),
            "match_count", matchIds.size()));
    }
}
