package com.flagship.lending_ledger.batch;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one batch run. Each item commits or fails on its own; a failed
 * item is listed here and does not affect the others.
 */
@Value
public class BatchResult {
    String job;
    LocalDate processDate;
    int attempted;
    int succeeded;
    /** Job-specific total: installments marked, interest accrued, deposits matured. */
    BigDecimal total;
    List<BatchItemFailure> failures;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
