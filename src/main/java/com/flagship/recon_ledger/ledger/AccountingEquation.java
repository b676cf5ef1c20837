package com.flagship.recon_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Assets = Liabilities + Equity + (Income - Expense), over reportable entries.
 *
 * {@code balanced} is exact. {@code withinReportingTolerance} compares the difference
 * rounded to cents against the display tolerance and is meant for presentation only.
 */
@Value
public class AccountingEquation {
    BigDecimal assets;
    BigDecimal liabilities;
    BigDecimal equity;
    BigDecimal income;
    BigDecimal expense;
    BigDecimal difference;
    boolean balanced;
    BigDecimal roundedDifference;
    boolean withinReportingTolerance;

    public static AccountingEquation of(BigDecimal assets, BigDecimal liabilities, BigDecimal equity,
                                        BigDecimal income, BigDecimal expense, BigDecimal reportingTolerance) {
        BigDecimal rightSide = liabilities.add(equity).add(income.subtract(expense));
        BigDecimal difference = assets.subtract(rightSide);
        BigDecimal rounded = difference.setScale(2, RoundingMode.HALF_UP);
        return new AccountingEquation(
            assets,
            liabilities,
            equity,
            income,
            expense,
            difference,
            difference.signum() == 0,
            rounded,
            rounded.abs().compareTo(reportingTolerance) <= 0
        );
    }
}
