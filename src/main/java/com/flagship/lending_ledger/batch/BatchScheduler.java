package com.flagship.lending_ledger.batch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Triggers the end-of-day jobs on {@code batch.scheduler.cron}.
 */
@Component
@ConditionalOnProperty(name = "batch.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BatchScheduler {

    private final BatchService batchService;
    private final Clock clock;

    @Scheduled(cron = "${batch.scheduler.cron:0 30 0 * * *}")
    public void runEndOfDay() {
        LocalDate today = LocalDate.now(clock);
        log.info("Scheduled end-of-day run for {}", today);
        batchService.runEndOfDay(today);
    }
}
