package com.flagship.lending_ledger.ledger;

/**
 * Categories of expected ledger failures.
 *
 * Callers branch on the kind; the message is for humans and logs.
 */
public enum LedgerErrorKind {
    UNBALANCED_ENTRY,
    ZERO_VALUE_ENTRY,
    INVALID_LINE,
    INVALID_ACCOUNT,
    PERIOD_CLOSED,
    PERIOD_NOT_CLOSABLE,
    INVALID_PERIOD_TRANSITION,
    ALREADY_REVERSED,
    NOT_POSTED,
    NOT_REVERSIBLE,
    INVALID_STATUS,
    NOT_FOUND,
    SELF_APPROVAL,
    APPROVAL_LIMIT_EXCEEDED,
    DUPLICATE_REFERENCE,
    INSUFFICIENT_BALANCE,
    OVERPAYMENT,
    INVALID_AMOUNT,
    CONFIG_ERROR
}
