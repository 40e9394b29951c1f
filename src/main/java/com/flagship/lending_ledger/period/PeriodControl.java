package com.flagship.lending_ledger.period;

import com.flagship.lending_ledger.ledger.JournalRepository;
import com.flagship.lending_ledger.ledger.LedgerContext;
import com.flagship.lending_ledger.ledger.LedgerError;
import com.flagship.lending_ledger.ledger.LedgerErrorKind;
import com.flagship.lending_ledger.ledger.LedgerResult;
import com.flagship.lending_ledger.ledger.event.PeriodClosedEvent;
import com.flagship.lending_ledger.observability.LedgerMetrics;
import com.flagship.lending_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Gates postings by financial period and moves periods through their close states.
 *
 * Key principles:
 * - Checked at write time: both draft creation and posting consult the period
 *   of the entry date at that moment
 * - One-way: OPEN -> SOFT_CLOSE -> HARD_CLOSE, never back
 * - A period with unposted entries cannot be closed
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodControl {

    private final PeriodRepository periodRepository;
    private final JournalRepository journalRepository;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Verifies that entries dated {@code entryDate} may be written, holding a
     * shared lock on the period row until the caller's transaction ends.
     *
     * @return empty when writing is allowed, otherwise a PERIOD_CLOSED error
     */
    public Optional<LedgerError> checkOpenForPosting(LocalDate entryDate) {
        YearMonth yearMonth = YearMonth.from(entryDate);
        periodRepository.ensureExists(yearMonth);
        FinancialPeriod period = periodRepository.lockShared(yearMonth)
            .orElseThrow(() -> new IllegalStateException("Period row missing after insert: " + yearMonth));

        if (!period.getStatus().acceptsPostings()) {
            return Optional.of(LedgerError.of(LedgerErrorKind.PERIOD_CLOSED,
                String.format("Period %d-%02d is closed for posting", period.getYear(), period.getMonth()),
                Map.of("year", period.getYear(), "month", period.getMonth(), "status", period.getStatus().name())));
        }
        return Optional.empty();
    }

    /**
     * Moves a period forward to SOFT_CLOSE or HARD_CLOSE.
     *
     * Fails with PERIOD_NOT_CLOSABLE when DRAFT or PENDING_APPROVAL entries are
     * dated inside the month; the error carries their count.
     */
    public LedgerResult<FinancialPeriod> closePeriod(LedgerContext context, int year, int month,
                                                     PeriodStatus closeType, String notes) {
        if (closeType == PeriodStatus.OPEN) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_PERIOD_TRANSITION,
                "A period cannot be closed to OPEN");
        }
        YearMonth yearMonth;
        try {
            yearMonth = YearMonth.of(year, month);
        } catch (DateTimeException e) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_PERIOD_TRANSITION,
                "Invalid period: " + year + "-" + month);
        }

        periodRepository.ensureExists(yearMonth);
        FinancialPeriod current = periodRepository.lockForUpdate(yearMonth)
            .orElseThrow(() -> new IllegalStateException("Period row missing after insert: " + yearMonth));

        if (current.getStatus() == PeriodStatus.HARD_CLOSE) {
            return LedgerResult.failure(LedgerErrorKind.PERIOD_CLOSED,
                String.format("Period %d-%02d is already hard closed", year, month));
        }
        if (!current.getStatus().canTransitionTo(closeType)) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_PERIOD_TRANSITION,
                String.format("Cannot move period %d-%02d from %s to %s", year, month, current.getStatus(), closeType));
        }

        long unposted = journalRepository.countUnposted(current.getStartDate(), current.getEndDate());
        if (unposted > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("unpostedCount", unposted);
            details.put("year", year);
            details.put("month", month);
            return LedgerResult.failure(LedgerErrorKind.PERIOD_NOT_CLOSABLE,
                "Cannot close period with " + unposted + " unposted journal entries", details);
        }

        FinancialPeriod closed = current.close(closeType, context.getActorId(), context.getNow(), notes);
        periodRepository.update(closed);

        outboxService.saveEvent(new PeriodClosedEvent(
            UUID.randomUUID(), year, month, closeType.name(), context.getActorId(), context.getNow()));
        ledgerMetrics.recordPeriodClosed(closeType.name());

        log.info("Period {}-{} moved from {} to {} by {}",
            year, String.format("%02d", month), current.getStatus(), closeType, context.getActorId());
        return LedgerResult.ok(closed);
    }

    /**
     * Current state of a period; months never touched are OPEN.
     */
    public FinancialPeriod getPeriod(int year, int month) {
        YearMonth yearMonth = YearMonth.of(year, month);
        return periodRepository.find(yearMonth).orElseGet(() -> FinancialPeriod.open(yearMonth));
    }
}
