package com.flagship.recon_ledger.statement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BankTransactionRepository extends JpaRepository<BankTransactionEntity, UUID> {

    /**
     * Transactions in scope with one of the given statuses. Null filters match everything.
     */
    @Query("""
        SELECT t.id FROM BankTransactionEntity t
        WHERE t.status IN :statuses
        AND (:accountId IS NULL OR t.sourceAccountId = :accountId)
        AND (:batchId IS NULL OR t.batchId = :batchId)
        AND (CAST(:fromDate AS date) IS NULL OR t.txnDate >= :fromDate)
        AND (CAST(:toDate AS date) IS NULL OR t.txnDate <= :toDate)
        ORDER BY t.txnDate ASC, t.id ASC
        """)
    List<UUID> findIdsInScope(@Param("statuses") Collection<BankTransactionStatus> statuses,
                              @Param("accountId") UUID accountId,
                              @Param("batchId") UUID batchId,
                              @Param("fromDate") LocalDate fromDate,
                              @Param("toDate") LocalDate toDate);

    @Query("""
        SELECT t FROM BankTransactionEntity t
        WHERE t.status IN :statuses
        AND (:accountId IS NULL OR t.sourceAccountId = :accountId)
        AND (:batchId IS NULL OR t.batchId = :batchId)
        AND (CAST(:fromDate AS date) IS NULL OR t.txnDate >= :fromDate)
        AND (CAST(:toDate AS date) IS NULL OR t.txnDate <= :toDate)
        ORDER BY t.txnDate ASC, t.id ASC
        """)
    List<BankTransactionEntity> findInScope(@Param("statuses") Collection<BankTransactionStatus> statuses,
                                            @Param("accountId") UUID accountId,
                                            @Param("batchId") UUID batchId,
                                            @Param("fromDate") LocalDate fromDate,
                                            @Param("toDate") LocalDate toDate);

    /**
     * Prior transactions of the same account, for history and duplicate detection.
     */
    List<BankTransactionEntity> findBySourceAccountIdAndTxnDateBetweenOrderByTxnDateAsc(
        UUID sourceAccountId, LocalDate from, LocalDate to);

    List<BankTransactionEntity> findByTxnDateBetweenOrderBySourceAccountIdAscTxnDateAsc(LocalDate from, LocalDate to);
}
