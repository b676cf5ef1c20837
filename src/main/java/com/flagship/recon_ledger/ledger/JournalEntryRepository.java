package com.flagship.recon_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntryEntity, UUID> {

    /**
     * Entries in a date window that can still be matched: the given statuses, never reversed.
     */
    @Query("""
        SELECT DISTINCT e FROM JournalEntryEntity e
        LEFT JOIN FETCH e.lines
        WHERE e.entryDate BETWEEN :from AND :to
        AND e.status IN :statuses
        AND e.reversedByEntryId IS NULL
        ORDER BY e.entryDate ASC, e.id ASC
        """)
    List<JournalEntryEntity> findMatchable(@Param("from") LocalDate from,
                                           @Param("to") LocalDate to,
                                           @Param("statuses") Collection<EntryStatus> statuses);

    @Query("""
        SELECT DISTINCT e FROM JournalEntryEntity e
        LEFT JOIN FETCH e.lines
        WHERE e.id IN :ids
        """)
    List<JournalEntryEntity> findAllWithLines(@Param("ids") Collection<UUID> ids);
}
