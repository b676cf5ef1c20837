package com.flagship.recon_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    Optional<AccountEntity> findByCode(String code);

    boolean existsByCode(String code);

    List<AccountEntity> findAllByOrderByCodeAsc();
}
