package com.flagship.lending_ledger.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query, so a Prometheus scrape never does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final ReconciliationMetrics reconciliationMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    /**
     * Full replay of posted lines; runs far less often than the outbox refresh.
     */
    @Scheduled(fixedRateString = "${metrics.reconciliation.interval:300000}",
               initialDelayString = "${metrics.reconciliation.initial-delay:60000}")
    public void refreshReconciliationMetrics() {
        try {
            reconciliationMetrics.refreshMetrics();
        } catch (RuntimeException e) {
            log.error("Balance reconciliation refresh failed", e);
        }
    }
}
