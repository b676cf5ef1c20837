package com.flagship.recon_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface JournalLineRepository extends JpaRepository<JournalLineEntity, UUID> {

    /**
     * Lines on the given accounts that count for reporting (posted or reconciled, not reversed),
     * oldest first.
     */
    @Query("""
        SELECT l FROM JournalLineEntity l
        JOIN FETCH l.entry e
        WHERE l.accountId IN :accountIds
        AND e.status IN (com.flagship.recon_ledger.ledger.EntryStatus.POSTED,
                         com.flagship.recon_ledger.ledger.EntryStatus.RECONCILED)
        AND e.reversedByEntryId IS NULL
        ORDER BY e.entryDate ASC, l.id ASC
        """)
    List<JournalLineEntity> findReportableLines(@Param("accountIds") Collection<UUID> accountIds);
}
