package com.flagship.recon_ledger.matching;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReconciliationRunRepository extends JpaRepository<ReconciliationRunEntity, UUID> {

    Optional<ReconciliationRunEntity> findByIdempotencyKey(String idempotencyKey);

    List<ReconciliationRunEntity> findByStatus(RunStatus status);
}
