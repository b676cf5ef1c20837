package com.flagship.recon_ledger.consistency;

import com.flagship.recon_ledger.config.ReconciliationProperties;
import com.flagship.recon_ledger.scoring.DescriptionSimilarity;
import com.flagship.recon_ledger.statement.BankTransaction;
import com.flagship.recon_ledger.statement.BankTransactionEntity;
import com.flagship.recon_ledger.statement.BankTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Statement lines that look like one bank movement reported twice: same account, amount
 * and direction, the same first 50 normalized description characters, at most a day apart.
 */
@Component
@RequiredArgsConstructor
public class DuplicateTransactionDetector implements ConsistencyDetector {

    static final int DESCRIPTION_PREFIX = 50;
    static final long MAX_DAYS_APART = 1;

    private final BankTransactionRepository transactionRepository;
    private final ReconciliationProperties properties;
    private final Clock clock;

    @Override
    public CheckType type() {
        return CheckType.DUPLICATE_TRANSACTION;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DetectedIssue> detect() {
        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusDays(properties.getConsistency().getLookbackDays());
        List<BankTransaction> transactions = transactionRepository
            .findByTxnDateBetweenOrderBySourceAccountIdAscTxnDateAsc(from, today.plusDays(1)).stream()
            .map(BankTransactionEntity::toDomain)
            .toList();
        return findDuplicates(transactions);
    }

    static List<DetectedIssue> findDuplicates(List<BankTransaction> transactions) {
        Map<UUID, List<BankTransaction>> byAccount = transactions.stream()
            .collect(Collectors.groupingBy(BankTransaction::getSourceAccountId));

        List<DetectedIssue> issues = new ArrayList<>();
        for (List<BankTransaction> account : byAccount.values()) {
            List<BankTransaction> sorted = account.stream()
                .sorted((a, b) -> {
                    int byDate = a.getTxnDate().compareTo(b.getTxnDate());
                    return byDate != 0 ? byDate : a.getId().compareTo(b.getId());
                })
                .toList();
            for (int i = 0; i < sorted.size(); i++) {
                BankTransaction first = sorted.get(i);
                for (int j = i + 1; j < sorted.size(); j++) {
                    BankTransaction second = sorted.get(j);
                    if (ChronoUnit.DAYS.between(first.getTxnDate(), second.getTxnDate()) > MAX_DAYS_APART) {
                        break;
                    }
                    if (looksLikeSameMovement(first, second)) {
                        issues.add(new DetectedIssue(CheckType.DUPLICATE_TRANSACTION, Severity.MEDIUM,
                            List.of(CheckSubject.transaction(first.getId()), CheckSubject.transaction(second.getId())),
                            Map.of("amount", first.getAmount().toPlainString(),
                                "direction", first.getDirection().name(),
                                "description", descriptionKey(first))));
                    }
                }
            }
        }
        return issues;
    }

    static boolean looksLikeSameMovement(BankTransaction a, BankTransaction b) {
        return a.getAmount().compareTo(b.getAmount()) == 0
            && a.getDirection() == b.getDirection()
            && descriptionKey(a).equals(descriptionKey(b));
    }

    private static String descriptionKey(BankTransaction transaction) {
        String normalized = DescriptionSimilarity.normalize(transaction.getDescription());
        return normalized.length() > DESCRIPTION_PREFIX ? normalized.substring(0, DESCRIPTION_PREFIX) : normalized;
    }
}
