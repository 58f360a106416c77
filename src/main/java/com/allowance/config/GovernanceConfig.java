package com.allowance.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class GovernanceConfig {

    /** Every read of "now" goes through this clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate ledgerRestTemplate(RestTemplateBuilder builder, GovernanceProperties properties) {
        GovernanceProperties.LedgerClient ledger = properties.getLedger();
        return builder
                .rootUri(ledger.getBaseUrl())
                .setConnectTimeout(ledger.getConnectTimeout())
                .setReadTimeout(ledger.getReadTimeout())
                .build();
    }
}
