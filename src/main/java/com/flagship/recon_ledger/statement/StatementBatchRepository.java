package com.flagship.recon_ledger.statement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface StatementBatchRepository extends JpaRepository<StatementBatchEntity, UUID> {
}
