package com.flagship.recon_ledger.routing;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ThresholdOverrideRepository extends JpaRepository<ThresholdOverrideEntity, UUID> {
}
