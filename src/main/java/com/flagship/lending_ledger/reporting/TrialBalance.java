package com.flagship.lending_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class TrialBalance {
    LocalDate asOfDate;
    List<TrialBalanceRow> rows;
    BigDecimal totalDebit;
    BigDecimal totalCredit;

    public boolean isBalanced() {
        return totalDebit.compareTo(totalCredit) == 0;
    }
}
