package com.flagship.recon_ledger.matching;

import com.flagship.recon_ledger.scoring.DescriptionSimilarity;
import com.flagship.recon_ledger.scoring.MatchHistory;
import com.flagship.recon_ledger.statement.BankTransaction;
import com.flagship.recon_ledger.statement.BankTransactionEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the accepted-match history of a transaction's merchant on the same account.
 */
@Service
@RequiredArgsConstructor
public class MatchHistoryService {

    private static final Set<MatchStatus> CONFIRMED = EnumSet.of(MatchStatus.ACCEPTED, MatchStatus.AUTO_ACCEPTED);

    private final MatchRepository matchRepository;

    @Transactional(readOnly = true)
    public MatchHistory historyFor(BankTransaction transaction) {
        String merchant = DescriptionSimilarity.merchantKey(transaction.getDescription());
        if (merchant.isEmpty()) {
            return MatchHistory.empty();
        }

        List<MatchHistory.Point> points = matchRepository.findConfirmedTransactions(
                transaction.getSourceAccountId(), CONFIRMED, transaction.getId(), transaction.getTxnDate())
            .stream()
            .map(BankTransactionEntity::toDomain)
            .filter(prior -> prior.getDirection() == transaction.getDirection())
            .filter(prior -> merchant.equals(DescriptionSimilarity.merchantKey(prior.getDescription())))
            .map(prior -> new MatchHistory.Point(prior.getTxnDate(), prior.getAmount()))
            .toList();
        return new MatchHistory(points);
    }
}
