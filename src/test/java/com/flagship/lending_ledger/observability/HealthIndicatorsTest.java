package com.flagship.lending_ledger.observability;

import com.flagship.lending_ledger.ledger.AccountRegistry;
import com.flagship.lending_ledger.ledger.LedgerError;
import com.flagship.lending_ledger.ledger.LedgerErrorKind;
import com.flagship.lending_ledger.ledger.LedgerException;
import com.flagship.lending_ledger.outbox.OutboxEventRepository;
import com.flagship.lending_ledger.reporting.BalanceCheck;
import com.flagship.lending_ledger.reporting.BalanceProjector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthIndicatorsTest {

    @Test
    @DisplayName("Outbox health degrades as the backlog grows")
    void testOutboxBacklogThresholds() {
        OutboxEventRepository repository = mock(OutboxEventRepository.class);
        HealthIndicators.OutboxHealthIndicator indicator = new HealthIndicators.OutboxHealthIndicator(repository);

        when(repository.countUnpublished()).thenReturn(12L);
        assertEquals(Status.UP, indicator.health().getStatus());

        when(repository.countUnpublished()).thenReturn(1500L);
        assertEquals("WARNING", indicator.health().getStatus().getCode());

        when(repository.countUnpublished()).thenReturn(20000L);
        Health critical = indicator.health();
        assertEquals(Status.DOWN, critical.getStatus());
        assertEquals(20000L, critical.getDetails().get("backlogSize"));
    }

    @Test
    @DisplayName("Unresolvable ledger accounts take the chart-of-accounts check down")
    void testChartOfAccountsDown() {
        AccountRegistry registry = mock(AccountRegistry.class);
        when(registry.resolve()).thenThrow(new LedgerException(LedgerError.of(LedgerErrorKind.CONFIG_ERROR,
            "Configured ledger accounts are not usable: CASH_BANK=1100 (header)")));

        Health health = new HealthIndicators.ChartOfAccountsHealthIndicator(registry).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("CONFIG_ERROR", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("Balance drift found by the last refresh takes reconciliation health down")
    void testReconciliationHealth() {
        BalanceProjector projector = mock(BalanceProjector.class);
        ReconciliationMetrics metrics = new ReconciliationMetrics(projector, new SimpleMeterRegistry());
        metrics.init();
        HealthIndicators.BalanceReconciliationHealthIndicator indicator =
            new HealthIndicators.BalanceReconciliationHealthIndicator(metrics);

        when(projector.findDriftedAccounts()).thenReturn(List.of());
        metrics.refreshMetrics();
        assertEquals(Status.UP, indicator.health().getStatus());

        when(projector.findDriftedAccounts()).thenReturn(List.of(
            new BalanceCheck(UUID.randomUUID(), "1100", new BigDecimal("101.00"), new BigDecimal("100.00"))));
        metrics.refreshMetrics();
        Health health = indicator.health();
        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(1L, health.getDetails().get("driftedAccounts"));
    }

    @Test
    @DisplayName("Missing Redis only degrades health")
    void testRedisDegraded() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);

        Health health = new HealthIndicators.RedisHealthIndicator(redisTemplate).health();

        assertEquals("DEGRADED", health.getStatus().getCode());
        assertNotNull(health.getDetails().get("note"));
    }
}
