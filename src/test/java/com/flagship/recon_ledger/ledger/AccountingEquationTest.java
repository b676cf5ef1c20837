package com.flagship.recon_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AccountingEquationTest {

    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    @Test
    @DisplayName("Assets equal liabilities plus equity plus net income")
    void testBalanced() {
        AccountingEquation equation = AccountingEquation.of(new BigDecimal("1500.00"), new BigDecimal("200.00"),
            new BigDecimal("1000.00"), new BigDecimal("500.00"), new BigDecimal("200.00"), TOLERANCE);

        assertTrue(equation.isBalanced());
        assertEquals(0, BigDecimal.ZERO.compareTo(equation.getDifference()));
        assertTrue(equation.isWithinReportingTolerance());
    }

    @Test
    @DisplayName("Sub-cent difference is not balanced but within reporting tolerance")
    void testToleranceIsPresentationOnly() {
        AccountingEquation equation = AccountingEquation.of(new BigDecimal("100.004"), new BigDecimal("100.00"),
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, TOLERANCE);

        assertFalse(equation.isBalanced());
        assertTrue(equation.isWithinReportingTolerance());
        assertEquals(new BigDecimal("0.00"), equation.getRoundedDifference());
    }

    @Test
    @DisplayName("Difference above tolerance is reported as out of balance")
    void testOutOfBalance() {
        AccountingEquation equation = AccountingEquation.of(new BigDecimal("100.00"), new BigDecimal("99.50"),
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, TOLERANCE);

        assertFalse(equation.isBalanced());
        assertFalse(equation.isWithinReportingTolerance());
        assertEquals(new BigDecimal("0.50"), equation.getRoundedDifference());
    }
}
