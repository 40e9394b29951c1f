package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.ledger.JournalEntryRequest;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * How a payment splits across installments. Produced by {@link RepaymentAllocator},
 * persisted by the loan workflow only once its journal entry has posted.
 */
@Value
public class RepaymentAllocation {
    BigDecimal amount;
    BigDecimal principalPortion;
    BigDecimal interestPortion;
    List<InstallmentAllocation> installments;

    /**
     * Debit cash for the whole payment; credit loans receivable with the
     * principal portion and interest income with the interest portion.
     * A zero-value credit is left out.
     */
    public List<JournalEntryRequest.Line> toJournalLines(String cashCode, String receivableCode,
                                                        String interestIncomeCode, String description) {
        List<JournalEntryRequest.Line> lines = new ArrayList<>(3);
        lines.add(JournalEntryRequest.Line.debit(cashCode, amount, description));
        if (principalPortion.signum() > 0) {
            lines.add(JournalEntryRequest.Line.credit(receivableCode, principalPortion, "Principal repayment"));
        }
        if (interestPortion.signum() > 0) {
            lines.add(JournalEntryRequest.Line.credit(interestIncomeCode, interestPortion, "Interest repayment"));
        }
        return lines;
    }
}
