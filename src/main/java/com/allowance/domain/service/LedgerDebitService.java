package com.allowance.domain.service;

import com.allowance.domain.exception.InsufficientFundsException;
import com.allowance.domain.exception.TransientException;
import com.allowance.domain.port.Ledger;
import com.allowance.domain.port.LedgerReceipt;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Debits a child's balance through the external {@link Ledger}.
 *
 * Called before any state is changed, so a failed debit leaves requests and
 * trackers untouched. Never retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerDebitService {

    private final Ledger ledger;
    private final MeterRegistry meterRegistry;

    public LedgerReceipt debit(UUID childId, BigDecimal amount, String description, String categoryId) {
        try {
            LedgerReceipt receipt = ledger.debit(childId, amount, description, categoryId);
            record("success");
            log.info("Debited {} from child {} (transaction {}, new balance {})",
                    amount, childId, receipt.getTransactionId(), receipt.getNewBalance());
            return receipt;
        } catch (InsufficientFundsException e) {
            record("insufficient_funds");
            log.warn("Ledger refused debit of {} for child {}: {}", amount, childId, e.getMessage());
            throw e;
        } catch (CallNotPermittedException e) {
            record("circuit_open");
            log.warn("Ledger circuit open, debit of {} for child {} not attempted", amount, childId);
            throw new TransientException("Ledger temporarily unavailable", e);
        } catch (TransientException e) {
            record("transient");
            log.warn("Ledger debit of {} for child {} failed: {}", amount, childId, e.getMessage());
            throw e;
        }
    }

    private void record(String result) {
        Counter.builder("governance.ledger.debit")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
