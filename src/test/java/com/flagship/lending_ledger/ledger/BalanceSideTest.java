package com.flagship.lending_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The sign rule and the balance deltas the posting engine derives from it.
 */
class BalanceSideTest {

    @Test
    @DisplayName("Debit-normal accounts grow with debits, credit-normal with credits")
    void testDelta() {
        BigDecimal hundred = new BigDecimal("100.00");
        BigDecimal thirty = new BigDecimal("30.00");

        assertEquals(0, new BigDecimal("70.00").compareTo(BalanceSide.DEBIT.delta(hundred, thirty)));
        assertEquals(0, new BigDecimal("-70.00").compareTo(BalanceSide.CREDIT.delta(hundred, thirty)));
        assertEquals(BalanceSide.CREDIT, BalanceSide.DEBIT.opposite());
    }

    @Test
    @DisplayName("Deltas are netted per account and ordered by account id")
    void testBalanceDeltas() {
        UUID cashId = UUID.fromString("00000000-0000-0000-0000-000000000002");
        UUID savingsId = UUID.fromString("00000000-0000-0000-0000-000000000001");
        Account cash = new Account(cashId, "1100", "Cash", AccountType.ASSET, BalanceSide.DEBIT,
            null, true, false, BigDecimal.ZERO, BigDecimal.ZERO);
        Account savings = new Account(savingsId, "2100", "Savings", AccountType.LIABILITY, BalanceSide.CREDIT,
            null, true, false, BigDecimal.ZERO, BigDecimal.ZERO);
        UUID entryId = UUID.randomUUID();

        List<JournalLine> lines = List.of(
            new JournalLine(UUID.randomUUID(), entryId, 1, cashId, "1100",
                new BigDecimal("500.00"), BigDecimal.ZERO, null, null, null, null),
            new JournalLine(UUID.randomUUID(), entryId, 2, cashId, "1100",
                BigDecimal.ZERO, new BigDecimal("200.00"), null, null, null, null),
            new JournalLine(UUID.randomUUID(), entryId, 3, savingsId, "2100",
                BigDecimal.ZERO, new BigDecimal("300.00"), null, null, null, null));

        Map<UUID, BigDecimal> deltas = JournalPostingEngine.balanceDeltas(lines, Map.of(cashId, cash, savingsId, savings));

        assertEquals(List.of(savingsId, cashId), List.copyOf(deltas.keySet()));
        assertEquals(0, new BigDecimal("300.00").compareTo(deltas.get(cashId)));
        assertEquals(0, new BigDecimal("300.00").compareTo(deltas.get(savingsId)));
    }

    @Test
    @DisplayName("Mirrored line swaps debit and credit")
    void testMirroredLine() {
        JournalEntryRequest.Line line = JournalEntryRequest.Line.debit("1100", new BigDecimal("12.50"), "Cash")
            .withCustomer("CUST-1");

        JournalEntryRequest.Line mirrored = line.mirrored("Reversal: Cash");

        assertEquals(0, BigDecimal.ZERO.compareTo(mirrored.getDebit()));
        assertEquals(0, new BigDecimal("12.50").compareTo(mirrored.getCredit()));
        assertEquals("CUST-1", mirrored.getCustomerId());
    }
}
