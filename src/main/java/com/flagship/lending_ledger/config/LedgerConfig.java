package com.flagship.lending_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Ledger infrastructure beans.
 *
 * The clock decides the business date of every posting and period check;
 * tests replace it to pin dates.
 */
@Configuration
public class LedgerConfig {

    @Value("${ledger.business-zone:UTC}")
    private String businessZone;

    @Bean
    public Clock ledgerClock() {
        return Clock.system(ZoneId.of(businessZone));
    }
}
