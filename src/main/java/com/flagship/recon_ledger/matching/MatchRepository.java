package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.statement.BankTransactionEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface MatchRepository extends JpaRepository<MatchEntity, UUID> {

    List<MatchEntity> findByBankTransactionIdOrderByCreatedAtAsc(UUID bankTransactionId);

    List<MatchEntity> findByStatusIn(Collection<MatchStatus> statuses);

    List<MatchEntity> findByBankTransactionIdIn(Collection<UUID> bankTransactionIds);

    List<MatchEntity> findByStatusAndCreatedAtBefore(MatchStatus status, Instant before);

    long countByStatus(MatchStatus status);

    /**
     * Review queue: pending matches filtered by statement account, score range and age.
     */
    @Query(value = """
        SELECT m FROM MatchEntity m, BankTransactionEntity t
        WHERE t.id = m.bankTransactionId
        AND m.status = :status
        AND (:accountId IS NULL OR t.sourceAccountId = :accountId)
        AND m.score >= :minScore AND m.score <= :maxScore
        AND m.createdAt < :createdBefore
        ORDER BY m.createdAt ASC, m.id ASC
        """,
        countQuery = """
        SELECT COUNT(m) FROM MatchEntity m, BankTransactionEntity t
        WHERE t.id = m.bankTransactionId
        AND m.status = :status
        AND (:accountId IS NULL OR t.sourceAccountId = :accountId)
        AND m.score >= :minScore AND m.score <= :maxScore
        AND m.createdAt < :createdBefore
        """)
    Page<MatchEntity> findQueue(@Param("status") MatchStatus status,
                                @Param("accountId") UUID accountId,
                                @Param("minScore") int minScore,
                                @Param("maxScore") int maxScore,
                                @Param("createdBefore") Instant createdBefore,
                                Pageable pageable);

    /**
     * Matches of the given statuses that include any of the entries.
     */
    @Query("""
        SELECT DISTINCT m FROM MatchEntity m JOIN m.entryIds e
        WHERE e IN :entryIds AND m.status IN :statuses
        """)
    List<MatchEntity> findByEntryIdsAndStatusIn(@Param("entryIds") Collection<UUID> entryIds,
                                                @Param("statuses") Collection<MatchStatus> statuses);

    /**
     * Earlier transactions of an account that ended in a confirmed match.
     */
    @Query("""
        SELECT DISTINCT t FROM BankTransactionEntity t, MatchEntity m
        WHERE m.bankTransactionId = t.id
        AND m.status IN :statuses
        AND t.sourceAccountId = :accountId
        AND t.id <> :excludeId
        AND t.txnDate < :before
        ORDER BY t.txnDate ASC
        """)
    List<BankTransactionEntity> findConfirmedTransactions(@Param("accountId") UUID accountId,
                                                          @Param("statuses") Collection<MatchStatus> statuses,
                                                          @Param("excludeId") UUID excludeId,
                                                          @Param("before") LocalDate before);
}
