package com.flagship.general_ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    /**
     * Source of "today" for numbering and timestamps. Replaced with a fixed clock in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
