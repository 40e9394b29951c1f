package com.flagship.lending_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Metrics for ledger and lending operations.
 *
 * Metrics exposed:
 * - ledger.entries.created: entries written (draft or posted)
 * - ledger.entries.posted: entries that reached POSTED
 * - ledger.entries.reversed: reversals
 * - ledger.entries.rejected: rejected operations, tagged by error kind
 * - ledger.posting.duration: time spent in a posting transition
 * - ledger.periods.closed: period closes, tagged by close type
 * - lending.repayments.amount: distribution of repayment amounts
 * - lending.operations: workflow operations, tagged by operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter entriesCreated;
    private final Counter entriesPosted;
    private final Counter entriesReversed;
    private final Timer postingTimer;
    private final DistributionSummary repaymentAmounts;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesCreated = Counter.builder("ledger.entries.created")
                .description("Number of journal entries written")
                .register(registry);

        this.entriesPosted = Counter.builder("ledger.entries.posted")
                .description("Number of journal entries posted")
                .register(registry);

        this.entriesReversed = Counter.builder("ledger.entries.reversed")
                .description("Number of journal entries reversed")
                .register(registry);

        this.postingTimer = Timer.builder("ledger.posting.duration")
                .description("Time taken to post a journal entry")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.repaymentAmounts = DistributionSummary.builder("lending.repayments.amount")
                .description("Loan repayment amounts")
                .register(registry);
    }

    public void incrementEntriesCreated() {
        entriesCreated.increment();
    }

    public void incrementEntriesPosted() {
        entriesPosted.increment();
    }

    public void incrementEntriesReversed() {
        entriesReversed.increment();
    }

    public void recordRejection(String errorKind) {
        registry.counter("ledger.entries.rejected", "kind", errorKind).increment();
    }

    public void recordPeriodClosed(String closeType) {
        registry.counter("ledger.periods.closed", "type", closeType).increment();
    }

    public void recordRepayment(BigDecimal amount) {
        repaymentAmounts.record(amount.doubleValue());
    }

    public void recordOperation(String operation) {
        registry.counter("lending.operations", "operation", operation).increment();
    }

    public <T> T timePosting(Supplier<T> posting) {
        return postingTimer.record(posting);
    }
}
