package com.flagship.recon_ledger.ledger;

import com.flagship.recon_ledger.config.LedgerProperties;
import com.flagship.recon_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Account administration. Accounts are configured, not derived; there is no hard delete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository repository;
    private final LedgerProperties ledgerProperties;

    @Transactional
    public Account createAccount(String code, String name, AccountType type, String currency) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Account code is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        if (repository.existsByCode(code)) {
            throw new IllegalArgumentException("Account code already in use: " + code);
        }

        String effectiveCurrency = currency == null || currency.isBlank()
            ? ledgerProperties.getBaseCurrency()
            : currency.toUpperCase();
        Account account = Account.create(UUID.randomUUID(), code, name == null ? code : name, type, effectiveCurrency);

        AccountEntity saved = repository.save(AccountEntity.fromDomain(account));
        log.info("Created account: id={}, code={}, type={}, currency={}", saved.getId(), code, type, effectiveCurrency);
        return saved.toDomain();
    }

    /**
     * Soft delete. Lines that reference the account are untouched; new postings are refused.
     */
    @Transactional
    public Account deactivate(UUID accountId) {
        AccountEntity entity = repository.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
        Account deactivated = entity.toDomain().deactivate();
        entity.updateFromDomain(deactivated);
        log.info("Deactivated account: id={}, code={}", accountId, entity.getCode());
        return repository.save(entity).toDomain();
    }

    @Transactional(readOnly = true)
    public Account getAccount(UUID accountId) {
        return repository.findById(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts() {
        return repository.findAllByOrderByCodeAsc().stream()
            .map(AccountEntity::toDomain)
            .toList();
    }
}
