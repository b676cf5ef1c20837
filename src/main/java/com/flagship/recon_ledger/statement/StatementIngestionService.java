package com.flagship.recon_ledger.statement;

import com.flagship.recon_ledger.exception.NotFoundException;
import com.flagship.recon_ledger.ledger.Account;
import com.flagship.recon_ledger.ledger.AccountEntity;
import com.flagship.recon_ledger.ledger.AccountRepository;
import com.flagship.recon_ledger.observability.ReconciliationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Stores extracted statements as a batch of PENDING bank transactions.
 *
 * The running balance is re-derived here (opening + IN - OUT = closing). A mismatch, or an
 * extractor that already reported one, does not reject the statement: every transaction
 * of the batch is flagged low-trust and can never be auto-accepted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementIngestionService {

    static final BigDecimal BALANCE_TOLERANCE = new BigDecimal("0.01");

    private final StatementBatchRepository batchRepository;
    private final BankTransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final ReconciliationMetrics metrics;

    @Transactional
    public IngestionResult ingest(StatementExtraction extraction) {
        Account source = accountRepository.findById(extraction.getSourceAccountId())
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Account", extraction.getSourceAccountId()));
        if (!source.isActive()) {
            throw new IllegalArgumentException("Statement account " + source.getCode() + " is inactive");
        }
        if (extraction.getTransactions() == null || extraction.getTransactions().isEmpty()) {
            throw new IllegalArgumentException("Statement has no transactions");
        }

        String currency = extraction.getCurrency() != null ? extraction.getCurrency() : source.getCurrency();
        boolean computedOk = balanceCheck(extraction);
        StatementBatch batch = new StatementBatch(UUID.randomUUID(), source.getId(),
            extraction.getPeriodStart(), extraction.getPeriodEnd(),
            extraction.getOpeningBalance(), extraction.getClosingBalance(),
            currency, extraction.getDocumentReference(),
            extraction.isExtractorBalanceOk(), computedOk,
            extraction.getTransactions().size(), null);
        StatementBatch savedBatch = batchRepository.save(StatementBatchEntity.fromDomain(batch)).toDomain();

        List<UUID> ids = new ArrayList<>();
        for (StatementExtraction.Line line : extraction.getTransactions()) {
            BankTransaction txn = BankTransaction.create(savedBatch.getId(), source.getId(), line.getTxnDate(),
                line.getAmount(), line.getDirection(), line.getDescription(), line.getReference(),
                line.getCurrency() != null ? line.getCurrency() : currency, savedBatch.isLowTrust());
            ids.add(transactionRepository.save(BankTransactionEntity.fromDomain(txn)).getId());
        }

        metrics.recordStatementIngested(savedBatch.isLowTrust(), ids.size());
        if (savedBatch.isLowTrust()) {
            log.warn("Statement balance check failed, batch is low-trust: batchId={}, extractorOk={}, computedOk={}",
                savedBatch.getId(), savedBatch.isExtractorBalanceOk(), savedBatch.isComputedBalanceOk());
        }
        log.info("Ingested statement: batchId={}, account={}, transactions={}",
            savedBatch.getId(), source.getCode(), ids.size());
        return new IngestionResult(savedBatch, ids);
    }

    @Transactional(readOnly = true)
    public BankTransaction getTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
            .map(BankTransactionEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("BankTransaction", transactionId));
    }

    /**
     * True when opening + IN - OUT lands within a cent of closing. A statement without
     * both balances cannot be verified and fails.
     */
    static boolean balanceCheck(StatementExtraction extraction) {
        if (extraction.getOpeningBalance() == null || extraction.getClosingBalance() == null) {
            return false;
        }
        BigDecimal running = extraction.getOpeningBalance();
        for (StatementExtraction.Line line : extraction.getTransactions()) {
            running = line.getDirection() == TransactionDirection.IN
                ? running.add(line.getAmount())
                : running.subtract(line.getAmount());
        }
        return running.subtract(extraction.getClosingBalance()).abs().compareTo(BALANCE_TOLERANCE) <= 0;
    }
}
