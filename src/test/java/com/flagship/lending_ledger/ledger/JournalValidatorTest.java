package com.flagship.lending_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural rules every journal entry must satisfy before anything is written.
 */
class JournalValidatorTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 10);

    private static JournalEntryRequest.JournalEntryRequestBuilder entry() {
        return JournalEntryRequest.builder()
            .entryDate(DATE)
            .description("Test entry");
    }

    private static Account account(String code, boolean active, boolean header) {
        return new Account(UUID.randomUUID(), code, "Account " + code, AccountType.ASSET, BalanceSide.DEBIT,
            null, active, header, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Balanced two-line entry passes")
    void testBalancedEntryPasses() {
        JournalEntryRequest request = entry()
            .line(JournalEntryRequest.Line.debit("1100", new BigDecimal("500.00"), "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", new BigDecimal("500.00"), "Capital"))
            .build();

        assertTrue(JournalValidator.validateStructure(request).isEmpty());
    }

    @Test
    @DisplayName("Sub-cent line amounts are INVALID_LINE, trailing zeros are fine")
    void testSubCentAmountRejected() {
        JournalEntryRequest subCent = entry()
            .line(JournalEntryRequest.Line.debit("1100", new BigDecimal("10.005"), "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", new BigDecimal("10.005"), "Capital"))
            .build();

        Optional<LedgerError> error = JournalValidator.validateStructure(subCent);

        assertTrue(error.isPresent());
        assertEquals(LedgerErrorKind.INVALID_LINE, error.get().getKind());
        assertEquals(1, error.get().detail("lineNumber"));

        JournalEntryRequest padded = entry()
            .line(JournalEntryRequest.Line.debit("1100", new BigDecimal("10.000"), "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", new BigDecimal("10.00"), "Capital"))
            .build();
        assertTrue(JournalValidator.validateStructure(padded).isEmpty());
    }

    @Test
    @DisplayName("Debits != credits is UNBALANCED_ENTRY with both totals")
    void testUnbalancedEntry() {
        JournalEntryRequest request = entry()
            .line(JournalEntryRequest.Line.debit("1100", new BigDecimal("100.00"), "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", new BigDecimal("99.99"), "Capital"))
            .build();

        Optional<LedgerError> error = JournalValidator.validateStructure(request);

        assertTrue(error.isPresent());
        assertEquals(LedgerErrorKind.UNBALANCED_ENTRY, error.get().getKind());
        assertEquals(0, new BigDecimal("100.00").compareTo((BigDecimal) error.get().detail("debitTotal")));
        assertEquals(0, new BigDecimal("99.99").compareTo((BigDecimal) error.get().detail("creditTotal")));
    }

    @Test
    @DisplayName("All-zero entry is ZERO_VALUE_ENTRY")
    void testZeroValueEntry() {
        JournalEntryRequest request = entry()
            .line(JournalEntryRequest.Line.debit("1100", BigDecimal.ZERO, "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", BigDecimal.ZERO, "Capital"))
            .build();

        assertEquals(LedgerErrorKind.ZERO_VALUE_ENTRY, JournalValidator.validateStructure(request).get().getKind());
    }

    @Test
    @DisplayName("Entry without lines is ZERO_VALUE_ENTRY")
    void testEmptyEntry() {
        assertEquals(LedgerErrorKind.ZERO_VALUE_ENTRY,
            JournalValidator.validateStructure(entry().build()).get().getKind());
    }

    @Test
    @DisplayName("Negative amount is INVALID_LINE and reported before the balance check")
    void testNegativeAmount() {
        JournalEntryRequest request = entry()
            .line(JournalEntryRequest.Line.debit("1100", new BigDecimal("-10.00"), "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", new BigDecimal("10.00"), "Capital"))
            .build();

        LedgerError error = JournalValidator.validateStructure(request).get();
        assertEquals(LedgerErrorKind.INVALID_LINE, error.getKind());
        assertEquals(1, error.detail("lineNumber"));
    }

    @Test
    @DisplayName("Line with both debit and credit is INVALID_LINE")
    void testTwoSidedLine() {
        JournalEntryRequest request = entry()
            .line(JournalEntryRequest.Line.builder().accountCode("1100")
                .debit(new BigDecimal("10.00")).credit(new BigDecimal("10.00")).build())
            .line(JournalEntryRequest.Line.debit("1110", new BigDecimal("5.00"), "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", new BigDecimal("5.00"), "Capital"))
            .build();

        LedgerError error = JournalValidator.validateStructure(request).get();
        assertEquals(LedgerErrorKind.INVALID_LINE, error.getKind());
        assertEquals("1100", error.detail("accountCode"));
    }

    @Test
    @DisplayName("Line with neither side is INVALID_LINE")
    void testEmptyLine() {
        JournalEntryRequest request = entry()
            .line(JournalEntryRequest.Line.debit("1100", new BigDecimal("5.00"), "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", new BigDecimal("5.00"), "Capital"))
            .line(JournalEntryRequest.Line.debit("1110", BigDecimal.ZERO, "Nothing"))
            .build();

        LedgerError error = JournalValidator.validateStructure(request).get();
        assertEquals(LedgerErrorKind.INVALID_LINE, error.getKind());
        assertEquals(3, error.detail("lineNumber"));
    }

    @Test
    @DisplayName("Missing description is INVALID_LINE")
    void testMissingDescription() {
        JournalEntryRequest request = entry()
            .description(" ")
            .line(JournalEntryRequest.Line.debit("1100", BigDecimal.ONE, "Cash"))
            .line(JournalEntryRequest.Line.credit("3100", BigDecimal.ONE, "Capital"))
            .build();

        assertEquals(LedgerErrorKind.INVALID_LINE, JournalValidator.validateStructure(request).get().getKind());
    }

    @Test
    @DisplayName("Unknown, inactive and header accounts are INVALID_ACCOUNT")
    void testInvalidAccounts() {
        Map<String, Account> accounts = Map.of(
            "1100", account("1100", true, false),
            "1000", account("1000", true, true),
            "1999", account("1999", false, false));

        Optional<LedgerError> error = JournalValidator.validateAccounts(
            List.of("1100", "1000", "1999", "7777"), accounts);

        assertTrue(error.isPresent());
        assertEquals(LedgerErrorKind.INVALID_ACCOUNT, error.get().getKind());
        assertEquals(List.of("1000", "1999", "7777"), error.get().detail("accountCodes"));
    }

    @Test
    @DisplayName("Postable accounts pass the account check")
    void testPostableAccounts() {
        Map<String, Account> accounts = Map.of(
            "1100", account("1100", true, false),
            "3100", account("3100", true, false));

        assertTrue(JournalValidator.validateAccounts(List.of("1100", "3100"), accounts).isEmpty());
    }
}
