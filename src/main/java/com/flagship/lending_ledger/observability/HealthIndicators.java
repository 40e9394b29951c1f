package com.flagship.lending_ledger.observability;

import com.flagship.lending_ledger.ledger.AccountRegistry;
import com.flagship.lending_ledger.ledger.LedgerException;
import com.flagship.lending_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the lending ledger.
 *
 * The chart of accounts and balance reconciliation decide whether the ledger
 * can be trusted; Redis is optional (database fallback), so it only degrades.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many ledger events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Every configured ledger account resolves to an active, postable account.
     */
    @Component("chartOfAccountsHealth")
    public static class ChartOfAccountsHealthIndicator implements HealthIndicator {

        private final AccountRegistry accountRegistry;

        public ChartOfAccountsHealthIndicator(AccountRegistry accountRegistry) {
            this.accountRegistry = accountRegistry;
        }

        @Override
        public Health health() {
            try {
                int resolved = accountRegistry.resolve().size();
                return Health.up()
                        .withDetail("configuredAccounts", resolved)
                        .build();
            } catch (LedgerException e) {
                return Health.down()
                        .withDetail("error", e.getError().getKind().name())
                        .withDetail("message", e.getError().getMessage())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Reports the drift count from the last reconciliation refresh.
     */
    @Component("balanceReconciliationHealth")
    public static class BalanceReconciliationHealthIndicator implements HealthIndicator {

        private final ReconciliationMetrics reconciliationMetrics;

        public BalanceReconciliationHealthIndicator(ReconciliationMetrics reconciliationMetrics) {
            this.reconciliationMetrics = reconciliationMetrics;
        }

        @Override
        public Health health() {
            long drifted = reconciliationMetrics.getDriftedAccounts();
            return (drifted == 0 ? Health.up() : Health.down())
                    .withDetail("driftedAccounts", drifted)
                    .build();
        }
    }

    /**
     * Redis backs the external-reference fast path only.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return degraded("Unexpected response: " + result);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Duplicate references are still detected through the database")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka producer connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
