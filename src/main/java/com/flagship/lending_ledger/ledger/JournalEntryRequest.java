package com.flagship.lending_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Request to record a journal entry.
 *
 * Lines reference accounts by their chart code. Structural rules (balance,
 * non-zero value, one-sided lines, postable accounts) are checked by the
 * posting engine, which answers with a {@link LedgerResult} rather than
 * throwing, so a request can be built from any caller input.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntryRequest {
    LocalDate entryDate;
    String description;
    @Builder.Default
    EntryType entryType = EntryType.STANDARD;
    String sourceModule;
    String sourceType;
    String sourceId;
    /** Caller-supplied idempotency key; unique across all entries when present. */
    String externalReference;
    /** Set only on reversal entries. */
    UUID reversesEntryId;
    @Singular
    List<Line> lines;

    public BigDecimal getDebitTotal() {
        return lines.stream()
            .map(Line::getDebit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return lines.stream()
            .map(Line::getCredit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }

    public List<String> getAccountCodes() {
        return lines.stream()
            .map(Line::getAccountCode)
            .distinct()
            .toList();
    }

    /**
     * A single debit or credit line. Exactly one side is expected to be positive.
     */
    @Value
    public static class Line {
        String accountCode;
        BigDecimal debit;
        BigDecimal credit;
        String description;
        String customerId;
        String referenceType;
        String referenceId;

        @Builder
        private Line(String accountCode, BigDecimal debit, BigDecimal credit, String description,
                     String customerId, String referenceType, String referenceId) {
            this.accountCode = Objects.requireNonNull(accountCode, "accountCode");
            this.debit = debit != null ? debit : BigDecimal.ZERO;
            this.credit = credit != null ? credit : BigDecimal.ZERO;
            this.description = description;
            this.customerId = customerId;
            this.referenceType = referenceType;
            this.referenceId = referenceId;
        }

        public static Line debit(String accountCode, BigDecimal amount, String description) {
            return new Line(accountCode, amount, BigDecimal.ZERO, description, null, null, null);
        }

        public static Line credit(String accountCode, BigDecimal amount, String description) {
            return new Line(accountCode, BigDecimal.ZERO, amount, description, null, null, null);
        }

        /**
         * The same line with debit and credit swapped, used to build reversals.
         */
        public Line mirrored(String mirroredDescription) {
            return new Line(accountCode, credit, debit, mirroredDescription, customerId, referenceType, referenceId);
        }

        public Line withCustomer(String customerId) {
            return new Line(accountCode, debit, credit, description, customerId, referenceType, referenceId);
        }

        public Line withReference(String referenceType, String referenceId) {
            return new Line(accountCode, debit, credit, description, customerId, referenceType, referenceId);
        }
    }
}
