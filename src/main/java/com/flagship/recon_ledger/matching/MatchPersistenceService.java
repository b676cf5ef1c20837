package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.exception.VersionConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link ReconciliationMatch} and {@link MatchEntity} for callers outside this package.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchPersistenceService {

    static final String AGGREGATE_TYPE = "ReconciliationMatch";

    private final MatchRepository matchRepository;

    /**
     * Inserts and flushes, so the row exists before anything references it.
     */
    @Transactional
    public ReconciliationMatch insert(ReconciliationMatch match) {
        MatchEntity saved = matchRepository.saveAndFlush(MatchEntity.fromDomain(match));
        log.debug("Saved match {} for transaction {}", saved.getId(), saved.getBankTransactionId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<ReconciliationMatch> findById(UUID matchId) {
        return matchRepository.findById(matchId).map(MatchEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public ReconciliationMatch getById(UUID matchId) {
        return findById(matchId).orElseThrow(() -> new NotFoundException(AGGREGATE_TYPE, matchId));
    }

    @Transactional(readOnly = true)
    public List<ReconciliationMatch> findForTransaction(UUID bankTransactionId) {
        return matchRepository.findByBankTransactionIdOrderByCreatedAtAsc(bankTransactionId).stream()
            .map(MatchEntity::toDomain)
            .toList();
    }

    /**
     * Writes a transition made on the version the caller read.
     *
     * @throws VersionConflictException if the stored version differs, or another writer
     *         got there first
     */
    @Transactional
    public ReconciliationMatch update(ReconciliationMatch updated, long expectedVersion) {
        MatchEntity existing = matchRepository.findById(updated.getId())
            .orElseThrow(() -> new NotFoundException(AGGREGATE_TYPE, updated.getId()));
        long actual = existing.getVersion() == null ? 0L : existing.getVersion();
        if (actual != expectedVersion) {
            throw new VersionConflictException(AGGREGATE_TYPE, updated.getId(), expectedVersion, actual);
        }

        existing.updateFromDomain(updated);
        try {
            MatchEntity saved = matchRepository.saveAndFlush(existing);
            log.debug("Updated match {} to {}", saved.getId(), saved.getStatus());
            return saved.toDomain();
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new VersionConflictException(AGGREGATE_TYPE, updated.getId(), expectedVersion, null);
        }
    }
}
