package com.flagship.lending_ledger.batch;

import com.flagship.lending_ledger.deposit.FixedDeposit;
import com.flagship.lending_ledger.deposit.FixedDepositService;
import com.flagship.lending_ledger.ledger.ActorIdentity;
import com.flagship.lending_ledger.ledger.LedgerResult;
import com.flagship.lending_ledger.loan.LoanService;
import com.flagship.lending_ledger.observability.CorrelationContext;
import com.flagship.lending_ledger.observability.LedgerMetrics;
import com.flagship.lending_ledger.savings.SavingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * End-of-day jobs over loans, fixed deposits and savings.
 *
 * Each item runs in its own ledger unit through the owning service, so a
 * failure rolls back that item alone. Items are selected before processing;
 * an item already handled by an earlier run is skipped by the selection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchService {

    private final LoanService loanService;
    private final FixedDepositService fixedDepositService;
    private final SavingsService savingsService;
    private final LedgerMetrics ledgerMetrics;

    public BatchResult markOverdueSchedules(LocalDate today) {
        return run("mark-overdue-schedules", today, loanService.findLoansWithNewlyOverdueInstallments(today),
            loanId -> loanService.markOverdueInstallments(ActorIdentity.system(), loanId, today)
                .map(marked -> BigDecimal.valueOf(marked.longValue())));
    }

    public BatchResult accrueFixedDepositInterest(LocalDate today) {
        return run("accrue-fixed-deposit-interest", today, fixedDepositService.findDueForAccrual(today),
            depositId -> fixedDepositService.accrueInterest(ActorIdentity.system(), depositId, today));
    }

    /**
     * Credits last month's interest to interest-bearing savings accounts. Runs
     * every day; an account is picked up once per month.
     */
    public BatchResult accrueSavingsInterest(LocalDate today) {
        return run("accrue-savings-interest", today, savingsService.findDueForInterest(today),
            accountId -> savingsService.creditMonthlyInterest(ActorIdentity.system(), accountId, today));
    }

    public BatchResult processMaturedDeposits(LocalDate today) {
        return run("process-matured-deposits", today, fixedDepositService.findMaturedBy(today),
            depositId -> fixedDepositService.processMaturity(ActorIdentity.system(), depositId, today)
                .map(FixedDeposit::getMaturityAmount));
    }

    /**
     * Overdue marking first, then maturity before accrual so a maturing
     * deposit is accrued exactly to its maturity date.
     */
    public List<BatchResult> runEndOfDay(LocalDate today) {
        List<BatchResult> results = new ArrayList<>();
        results.add(markOverdueSchedules(today));
        results.add(processMaturedDeposits(today));
        results.add(accrueFixedDepositInterest(today));
        results.add(accrueSavingsInterest(today));
        return results;
    }

    private BatchResult run(String job, LocalDate today, List<UUID> itemIds,
                            Function<UUID, LedgerResult<BigDecimal>> processItem) {
        CorrelationContext.setCorrelationId(job + "-" + CorrelationContext.generateCorrelationId());
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        try {
            log.info("Batch {} for {} starting with {} items", job, today, itemIds.size());
            int succeeded = 0;
            BigDecimal total = BigDecimal.ZERO;
            List<BatchItemFailure> failures = new ArrayList<>();

            for (UUID itemId : itemIds) {
                try {
                    LedgerResult<BigDecimal> result = processItem.apply(itemId);
                    if (result.isSuccess()) {
                        succeeded++;
                        total = total.add(result.getValue());
                    } else {
                        failures.add(new BatchItemFailure(itemId, result.getError().getKind().name(),
                            result.getError().getMessage()));
                        log.warn("Batch {} item {} rejected: {}", job, itemId, result.getError());
                    }
                } catch (RuntimeException e) {
                    failures.add(new BatchItemFailure(itemId, e.getClass().getSimpleName(), e.getMessage()));
                    log.error("Batch {} item {} failed", job, itemId, e);
                }
            }

            ledgerMetrics.recordOperation("batch." + job);
            BatchResult result = new BatchResult(job, today, itemIds.size(), succeeded, total, List.copyOf(failures));
            log.info("Batch {} for {} finished: {}/{} succeeded, total={}, failures={}",
                job, today, succeeded, itemIds.size(), total, failures.size());
            return result;
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }
}
