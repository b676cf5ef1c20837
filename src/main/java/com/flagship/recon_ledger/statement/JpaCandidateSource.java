package com.flagship.recon_ledger.statement;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import com.flagship.recon_ledger.ledger.Account;
import com.flagship.recon_ledger.ledger.AccountEntity;
import com.flagship.recon_ledger.ledger.AccountRepository;
import com.flagship.recon_ledger.ledger.EntryStatus;
import com.flagship.recon_ledger.ledger.JournalEntry;
import com.flagship.recon_ledger.ledger.JournalEntryEntity;
import com.flagship.recon_ledger.ledger.JournalEntryRepository;
import com.flagship.recon_ledger.ledger.JournalLine;
import com.flagship.recon_ledger.scoring.CandidateEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaCandidateSource implements CandidateSource {

    private static final Set<EntryStatus> MATCHABLE = EnumSet.of(EntryStatus.POSTED, EntryStatus.DRAFT);
    private static final Set<BankTransactionStatus> OPEN =
        EnumSet.of(BankTransactionStatus.PENDING, BankTransactionStatus.UNMATCHED);

    private final BankTransactionRepository transactionRepository;
    private final JournalEntryRepository entryRepository;
    private final AccountRepository accountRepository;
    private final ReconciliationProperties properties;

    @Override
    @Transactional(readOnly = true)
    public List<UUID> transactionsToMatch(ReconciliationScope scope) {
        return transactionRepository.findIdsInScope(OPEN, scope.getAccountId(), scope.getBatchId(),
            scope.getDateFrom(), scope.getDateTo());
    }

    @Override
    @Transactional(readOnly = true)
    public List<CandidateEntry> candidatesFor(BankTransaction transaction) {
        int window = properties.getCandidates().getWindowDays();
        LocalDate from = transaction.getTxnDate().minusDays(window);
        LocalDate to = transaction.getTxnDate().plusDays(window);

        List<JournalEntry> entries = entryRepository.findMatchable(from, to, MATCHABLE).stream()
            .map(JournalEntryEntity::toDomain)
            .toList();
        return asCandidates(entries);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CandidateEntry> asCandidates(List<JournalEntry> entries) {
        if (entries.isEmpty()) {
            return List.of();
        }

        Set<UUID> accountIds = entries.stream()
            .flatMap(e -> e.getLines().stream())
            .map(JournalLine::getAccountId)
            .collect(Collectors.toSet());
        Map<UUID, Account> accounts = accountRepository.findAllById(accountIds).stream()
            .map(AccountEntity::toDomain)
            .collect(Collectors.toMap(Account::getId, Function.identity()));

        Set<UUID> clearing = properties.getClearingAccountIds();
        return entries.stream()
            .map(e -> CandidateEntry.from(e, accounts, clearing))
            .toList();
    }
}
