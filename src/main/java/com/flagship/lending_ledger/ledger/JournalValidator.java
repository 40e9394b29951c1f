package com.flagship.lending_ledger.ledger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural checks on a journal entry request. Pure, no I/O.
 *
 * Checks run in a fixed order and the first failure wins:
 * 1. No negative amounts, at most two decimal places
 * 2. Debits equal credits
 * 3. Entry carries value
 * 4. Every line is one-sided
 * 5. Every referenced account exists, is active and is not a header
 *
 * The period check comes before all of these and lives in period control.
 */
public final class JournalValidator {

    private JournalValidator() {
    }

    public static Optional<LedgerError> validateStructure(JournalEntryRequest request) {
        if (request.getEntryDate() == null) {
            return Optional.of(LedgerError.of(LedgerErrorKind.INVALID_LINE, "Entry date is required"));
        }
        if (request.getDescription() == null || request.getDescription().isBlank()) {
            return Optional.of(LedgerError.of(LedgerErrorKind.INVALID_LINE, "Entry description is required"));
        }

        List<JournalEntryRequest.Line> lines = request.getLines();
        for (int i = 0; i < lines.size(); i++) {
            JournalEntryRequest.Line line = lines.get(i);
            if (line.getDebit().signum() < 0 || line.getCredit().signum() < 0) {
                return Optional.of(lineError(i + 1, line, "Line amounts must not be negative"));
            }
            if (exceedsCents(line.getDebit()) || exceedsCents(line.getCredit())) {
                return Optional.of(lineError(i + 1, line, "Line amounts must not have more than 2 decimals"));
            }
        }

        BigDecimal debitTotal = request.getDebitTotal();
        BigDecimal creditTotal = request.getCreditTotal();
        if (debitTotal.compareTo(creditTotal) != 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("debitTotal", debitTotal);
            details.put("creditTotal", creditTotal);
            return Optional.of(LedgerError.of(LedgerErrorKind.UNBALANCED_ENTRY,
                String.format("Entry is not balanced: debits=%s, credits=%s", debitTotal, creditTotal),
                details));
        }

        if (debitTotal.signum() == 0) {
            return Optional.of(LedgerError.of(LedgerErrorKind.ZERO_VALUE_ENTRY,
                "Entry must have a non-zero value"));
        }

        for (int i = 0; i < lines.size(); i++) {
            JournalEntryRequest.Line line = lines.get(i);
            boolean hasDebit = line.getDebit().signum() > 0;
            boolean hasCredit = line.getCredit().signum() > 0;
            if (hasDebit == hasCredit) {
                return Optional.of(lineError(i + 1, line, "Each line must carry exactly one of debit or credit"));
            }
        }
        return Optional.empty();
    }

    /**
     * Checks every code in the request against the accounts found for it.
     *
     * @param accountsByCode accounts that exist, keyed by code; missing codes are invalid
     */
    public static Optional<LedgerError> validateAccounts(Collection<String> accountCodes,
                                                         Map<String, Account> accountsByCode) {
        List<String> invalid = new ArrayList<>();
        for (String code : accountCodes) {
            Account account = accountsByCode.get(code);
            if (account == null || !account.isPostable()) {
                invalid.add(code);
            }
        }
        if (invalid.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(LedgerError.of(LedgerErrorKind.INVALID_ACCOUNT,
            "Invalid or inactive accounts: " + String.join(", ", invalid),
            Map.of("accountCodes", List.copyOf(invalid))));
    }

    private static boolean exceedsCents(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() > 2;
    }

    private static LedgerError lineError(int lineNumber, JournalEntryRequest.Line line, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lineNumber", lineNumber);
        details.put("accountCode", line.getAccountCode());
        details.put("debit", line.getDebit());
        details.put("credit", line.getCredit());
        return LedgerError.of(LedgerErrorKind.INVALID_LINE, message + " (line " + lineNumber + ")", details);
    }
}
