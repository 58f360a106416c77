package com.allowance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Spending governance for a family allowance system.
 *
 * Decides whether a child may spend an amount, tracks spending against daily,
 * weekly and monthly limits, and runs purchases that need a parent's approval
 * through a request lifecycle with a scheduled expiration sweep.
 *
 * Money movement is delegated to the ledger service; notifications leave
 * through a transactional outbox to Kafka.
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
public class SpendingGovernanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpendingGovernanceApplication.class, args);
    }
}
