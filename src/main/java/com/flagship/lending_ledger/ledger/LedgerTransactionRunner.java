package com.flagship.lending_ledger.ledger;

import com.flagship.lending_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.function.Function;

/**
 * Runs a unit of ledger work in one bounded transaction.
 *
 * Bounds:
 * - Execution: transaction timeout ({@code ledger.transaction.timeout-seconds})
 * - Waiting on row locks: {@code SET LOCAL lock_timeout} ({@code ledger.transaction.lock-timeout-ms})
 *
 * A failed {@link LedgerResult} rolls the unit back, as does any exception.
 * Nothing written inside the unit becomes visible unless the whole unit succeeds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerTransactionRunner {

    private final PlatformTransactionManager transactionManager;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Value("${ledger.transaction.timeout-seconds:30}")
    private int timeoutSeconds;

    @Value("${ledger.transaction.lock-timeout-ms:10000}")
    private long lockTimeoutMs;

    public <T> LedgerResult<T> execute(ActorIdentity actor, Function<LedgerContext, LedgerResult<T>> work) {
        boolean ownsCorrelation = !CorrelationContext.hasCorrelationId();
        if (ownsCorrelation) {
            CorrelationContext.setCorrelationId(null);
        }
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        try {
            TransactionTemplate template = new TransactionTemplate(transactionManager);
            template.setTimeout(timeoutSeconds);

            return template.execute(status -> {
                jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
                LedgerContext context = new LedgerContext(actor, LocalDate.now(clock), clock.instant(), status);

                LedgerResult<T> result = work.apply(context);
                if (result.isFailure()) {
                    status.setRollbackOnly();
                    log.warn("Ledger unit rejected, rolling back: actor={}, error={}", actor.getId(), result.getError());
                }
                return result;
            });
        } finally {
            if (ownsCorrelation) {
                CorrelationContext.clear();
                MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            }
        }
    }
}
