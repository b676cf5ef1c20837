package com.flagship.recon_ledger.ledger;

import com.flagship.recon_ledger.config.LedgerProperties;
import com.flagship.recon_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Balances and the accounting equation, aggregated in SQL.
 *
 * Only POSTED and RECONCILED entries that have not been reversed contribute. Reversal
 * records are VOID and never counted, so a voided entry drops out of every report.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReportingService {

    private static final String REPORTABLE = """
        e.status IN ('POSTED', 'RECONCILED') AND e.reversed_by_entry_id IS NULL
        """;

    private final JdbcTemplate jdbcTemplate;
    private final AccountRepository accountRepository;
    private final LedgerProperties ledgerProperties;

    /**
     * Balance in the account's natural sign: debit-normal accounts report debits minus
     * credits, the others credits minus debits.
     */
    @Transactional(readOnly = true)
    public BigDecimal getAccountBalance(UUID accountId) {
        AccountEntity account = accountRepository.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));

        BigDecimal netDebit = jdbcTemplate.queryForObject("""
            SELECT COALESCE(SUM(CASE WHEN l.direction = 'DEBIT'
                                     THEN l.amount * COALESCE(l.fx_rate, 1)
                                     ELSE -(l.amount * COALESCE(l.fx_rate, 1)) END), 0)
            FROM journal_lines l
            JOIN journal_entries e ON e.id = l.entry_id
            WHERE l.account_id = ? AND
            """ + REPORTABLE,
            BigDecimal.class,
            accountId
        );

        BigDecimal net = netDebit == null ? BigDecimal.ZERO : netDebit;
        return account.getType().isDebitNormal() ? net : net.negate();
    }

    @Transactional(readOnly = true)
    public AccountingEquation getAccountingEquation() {
        Map<AccountType, BigDecimal> totals = new EnumMap<>(AccountType.class);
        for (AccountType type : AccountType.values()) {
            totals.put(type, BigDecimal.ZERO);
        }

        List<Map<String, Object>> rows = jdbcTemplate.queryForList("""
            SELECT a.account_type AS account_type,
                   COALESCE(SUM(CASE WHEN l.direction = 'DEBIT'
                                     THEN l.amount * COALESCE(l.fx_rate, 1)
                                     ELSE -(l.amount * COALESCE(l.fx_rate, 1)) END), 0) AS net_debit
            FROM journal_lines l
            JOIN journal_entries e ON e.id = l.entry_id
            JOIN accounts a ON a.id = l.account_id
            WHERE
            """ + REPORTABLE + """
            GROUP BY a.account_type
            """);

        for (Map<String, Object> row : rows) {
            AccountType type = AccountType.valueOf((String) row.get("account_type"));
            BigDecimal netDebit = (BigDecimal) row.get("net_debit");
            totals.put(type, type.isDebitNormal() ? netDebit : netDebit.negate());
        }

        AccountingEquation equation = AccountingEquation.of(
            totals.get(AccountType.ASSET),
            totals.get(AccountType.LIABILITY),
            totals.get(AccountType.EQUITY),
            totals.get(AccountType.INCOME),
            totals.get(AccountType.EXPENSE),
            ledgerProperties.getReportingTolerance()
        );

        if (!equation.isBalanced()) {
            log.error("Accounting equation does not hold: difference={}", equation.getDifference());
        }
        return equation;
    }
}
