package com.flagship.lending_ledger.loan;

public enum LoanStatus {
    PENDING_DISBURSEMENT,
    ACTIVE,
    OVERDUE,
    CLOSED;

    public boolean acceptsRepayment() {
        return this == ACTIVE || this == OVERDUE;
    }
}
