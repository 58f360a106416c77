package com.allowance.domain.service;

import com.allowance.domain.exception.InsufficientFundsException;
import com.allowance.domain.exception.TransientException;
import com.allowance.domain.port.Ledger;
import com.allowance.domain.port.LedgerReceipt;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerDebitServiceTest {

    @Mock private Ledger ledger;

    private MeterRegistry meterRegistry;
    private LedgerDebitService ledgerDebitService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ledgerDebitService = new LedgerDebitService(ledger, meterRegistry);
    }

    @Test
    void debit_success_returnsReceipt() {
        LedgerReceipt receipt = new LedgerReceipt(UUID.randomUUID(), new BigDecimal("35.00"));
        when(ledger.debit(any(), any(), any(), any())).thenReturn(receipt);

        assertSame(receipt, ledgerDebitService.debit(UUID.randomUUID(), new BigDecimal("15.00"), "Lego set", null));
        assertEquals(1.0, meterRegistry.counter("governance.ledger.debit", "result", "success").count());
    }

    @Test
    void debit_insufficientFunds_propagates() {
        when(ledger.debit(any(), any(), any(), any())).thenThrow(new InsufficientFundsException("Insufficient funds"));

        assertThrows(InsufficientFundsException.class,
                () -> ledgerDebitService.debit(UUID.randomUUID(), new BigDecimal("15.00"), "Lego set", null));
        assertEquals(1.0, meterRegistry.counter("governance.ledger.debit", "result", "insufficient_funds").count());
    }

    @Test
    void debit_openCircuit_isTransient() {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("ledger");
        breaker.transitionToOpenState();
        when(ledger.debit(any(), any(), any(), any()))
                .thenThrow(CallNotPermittedException.createCallNotPermittedException(breaker));

        TransientException e = assertThrows(TransientException.class,
                () -> ledgerDebitService.debit(UUID.randomUUID(), new BigDecimal("15.00"), "Lego set", null));
        assertInstanceOf(CallNotPermittedException.class, e.getCause());
    }
}
