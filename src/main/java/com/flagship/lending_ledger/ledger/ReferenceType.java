package com.flagship.lending_ledger.ledger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Human-facing reference number families and the sequences that back them.
 */
@Getter
@RequiredArgsConstructor
public enum ReferenceType {
    JOURNAL("JE", "journal_entry_number_seq"),
    RECEIPT("RC", "receipt_number_seq"),
    LOAN("LN", "loan_number_seq"),
    SAVINGS_ACCOUNT("SA", "savings_account_number_seq"),
    SAVINGS_TRANSACTION("ST", "savings_transaction_seq"),
    FIXED_DEPOSIT("FD", "fd_certificate_seq");

    private final String prefix;
    private final String sequenceName;
}
