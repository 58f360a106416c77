package com.allowance.infrastructure.ledger;

import com.allowance.domain.exception.InsufficientFundsException;
import com.allowance.domain.exception.TransientException;
import com.allowance.domain.exception.ValidationException;
import com.allowance.domain.port.Ledger;
import com.allowance.domain.port.LedgerReceipt;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * {@link Ledger} backed by the ledger service's REST API.
 *
 * Connect and read timeouts come from {@code governance.ledger.*}; timeouts and
 * 5xx answers become {@link TransientException}. The circuit breaker stops
 * calling a ledger that keeps failing. No retries: a retried debit could
 * charge the child twice.
 */
@Slf4j
@Component
public class RestLedgerClient implements Ledger {

    static final String DEBIT_PATH = "/api/v1/children/{childId}/debits";

    private final RestTemplate restTemplate;

    public RestLedgerClient(@Qualifier("ledgerRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    @CircuitBreaker(name = "ledger")
    public LedgerReceipt debit(UUID childId, BigDecimal amount, String description, String categoryId) {
        LedgerDebitRequest body = LedgerDebitRequest.builder()
                .amount(amount)
                .description(description)
                .categoryId(categoryId)
                .source("spending-governance")
                .build();
        try {
            LedgerReceipt receipt = restTemplate.postForObject(DEBIT_PATH, body, LedgerReceipt.class, childId);
            if (receipt == null || receipt.getTransactionId() == null) {
                throw new TransientException("Ledger returned an empty debit response");
            }
            return receipt;
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.CONFLICT)
                    || e.getStatusCode().isSameCodeAs(HttpStatus.UNPROCESSABLE_ENTITY)) {
                throw new InsufficientFundsException("Insufficient funds for a purchase of " + amount);
            }
            log.error("Ledger rejected debit for child {}: {} {}", childId, e.getStatusCode(), e.getResponseBodyAsString());
            throw new ValidationException("Ledger rejected the debit: " + e.getStatusCode());
        } catch (HttpServerErrorException e) {
            throw new TransientException("Ledger error " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new TransientException("Ledger did not respond in time", e);
        }
    }
}
