package com.flagship.lending_ledger.reporting;

import com.flagship.lending_ledger.ledger.AccountType;
import com.flagship.lending_ledger.ledger.BalanceSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TrialBalanceRowTest {

    @Test
    @DisplayName("Positive balance goes to the account's normal side")
    void testNormalSide() {
        TrialBalanceRow asset = BalanceProjector.toTrialBalanceRow("1100", "Cash", AccountType.ASSET,
            BalanceSide.DEBIT, new BigDecimal("250.00")).orElseThrow();
        TrialBalanceRow income = BalanceProjector.toTrialBalanceRow("4100", "Interest", AccountType.INCOME,
            BalanceSide.CREDIT, new BigDecimal("80.00")).orElseThrow();

        assertEquals(0, new BigDecimal("250.00").compareTo(asset.getDebit()));
        assertEquals(0, BigDecimal.ZERO.compareTo(asset.getCredit()));
        assertEquals(0, new BigDecimal("80.00").compareTo(income.getCredit()));
        assertEquals(0, BigDecimal.ZERO.compareTo(income.getDebit()));
    }

    @Test
    @DisplayName("Contra balance moves to the opposite column")
    void testContraBalance() {
        TrialBalanceRow overdrawn = BalanceProjector.toTrialBalanceRow("1100", "Cash", AccountType.ASSET,
            BalanceSide.DEBIT, new BigDecimal("-40.00")).orElseThrow();

        assertEquals(0, BigDecimal.ZERO.compareTo(overdrawn.getDebit()));
        assertEquals(0, new BigDecimal("40.00").compareTo(overdrawn.getCredit()));
    }

    @Test
    @DisplayName("Zero balances are omitted")
    void testZeroOmitted() {
        Optional<TrialBalanceRow> row = BalanceProjector.toTrialBalanceRow("1100", "Cash", AccountType.ASSET,
            BalanceSide.DEBIT, new BigDecimal("0.00"));

        assertTrue(row.isEmpty());
    }
}
