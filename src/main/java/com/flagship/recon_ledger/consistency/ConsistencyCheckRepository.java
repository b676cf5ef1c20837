package com.flagship.recon_ledger.consistency;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConsistencyCheckRepository extends JpaRepository<ConsistencyCheckEntity, UUID> {

    Optional<ConsistencyCheckEntity> findByFingerprint(String fingerprint);

    long countByStatus(CheckStatus status);

    long countByStatusAndSeverityIn(CheckStatus status, Collection<Severity> severities);

    /**
     * Pending checks at one of the given severities that mention any of the subject ids.
     */
    @Query("""
        SELECT DISTINCT c FROM ConsistencyCheckEntity c JOIN c.subjects s
        WHERE c.status = com.flagship.recon_ledger.consistency.CheckStatus.PENDING
        AND c.severity IN :severities
        AND s.subjectId IN :subjectIds
        """)
    List<ConsistencyCheckEntity> findPendingForSubjects(@Param("subjectIds") Collection<UUID> subjectIds,
                                                        @Param("severities") Collection<Severity> severities);

    @Query(value = """
        SELECT c FROM ConsistencyCheckEntity c
        WHERE (:status IS NULL OR c.status = :status)
        AND (:type IS NULL OR c.checkType = :type)
        AND c.severity IN :severities
        ORDER BY c.createdAt DESC, c.id ASC
        """,
        countQuery = """
        SELECT COUNT(c) FROM ConsistencyCheckEntity c
        WHERE (:status IS NULL OR c.status = :status)
        AND (:type IS NULL OR c.checkType = :type)
        AND c.severity IN :severities
        """)
    Page<ConsistencyCheckEntity> search(@Param("status") CheckStatus status,
                                        @Param("type") CheckType type,
                                        @Param("severities") Collection<Severity> severities,
                                        Pageable pageable);
}
