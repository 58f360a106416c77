package com.allowance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Settings under {@code governance.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "governance")
@Data
public class GovernanceProperties {

    private Defaults defaults = new Defaults();

    /** Share of a limit above which a check adds a warning. */
    private BigDecimal warningRatio = new BigDecimal("0.8");

    private Locking locking = new Locking();

    private Storage storage = new Storage();

    private Trackers trackers = new Trackers();

    private Idempotency idempotency = new Idempotency();

    private LedgerClient ledger = new LedgerClient();

    /**
     * Approval settings given to a child the first time the engine sees them.
     */
    @Data
    public static class Defaults {
        private boolean enabled = true;
        private BigDecimal approvalThreshold = new BigDecimal("10.00");
        private int requestExpirationHours = 72;
        private boolean autoApproveUnderThreshold = true;
    }

    @Data
    public static class Locking {
        private Duration timeout = Duration.ofSeconds(5);
        private int stripes = 256;
    }

    @Data
    public static class Storage {
        private Duration transactionTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Trackers {
        private Duration retention = Duration.ofDays(400);
    }

    @Data
    public static class Idempotency {
        private Duration window = Duration.ofHours(24);
    }

    @Data
    public static class LedgerClient {
        private String baseUrl = "http://localhost:8081";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);
    }
}
