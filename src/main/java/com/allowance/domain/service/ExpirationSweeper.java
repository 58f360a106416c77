package com.allowance.domain.service;

import com.allowance.config.GovernanceProperties;
import com.allowance.domain.model.RequestStatus;
import com.allowance.domain.model.SweepResult;
import com.allowance.infrastructure.persistence.entity.SpendingRequestEntity;
import com.allowance.infrastructure.persistence.repository.SpendingRequestRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Expires pending requests whose deadline has passed and cleans up old data.
 *
 * Each request is expired on its own; a failure is logged and the sweep moves
 * on. Losing a race against a parent's response or a cancellation is not an
 * error. The scheduled method only delegates to {@link #sweep()}, which tests
 * call directly with a controlled clock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpirationSweeper {

    private final SpendingRequestRepository requestRepository;
    private final RequestLifecycle requestLifecycle;
    private final LimitTracker limitTracker;
    private final IdempotencyService idempotencyService;
    private final GovernanceProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${app.sweeper.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${app.sweeper.interval-ms:300000}",
            initialDelayString = "${app.sweeper.initial-delay-ms:60000}")
    public void sweepExpiredRequests() {
        try {
            SweepResult result = sweep();
            if (result.getExpired() > 0 || result.getFailed() > 0) {
                log.info("Expiration sweep: {} expired, {} skipped, {} failed, {} trackers purged",
                        result.getExpired(), result.getSkipped(), result.getFailed(), result.getPurgedTrackers());
            }
        } catch (Exception e) {
            log.error("Error in expiration sweep: {}", e.getMessage(), e);
        }
    }

    public SweepResult sweep() {
        Instant now = clock.instant();
        int expired = 0;
        int skipped = 0;
        int failed = 0;
        Set<UUID> attempted = new HashSet<>();

        while (true) {
            // requests that failed stay pending and come back first, so widen the page by that many
            int pageSize = batchSize + failed;
            List<SpendingRequestEntity> batch = requestRepository.findByStatusAndExpiresAtBeforeOrderByExpiresAtAsc(
                    RequestStatus.PENDING, now, PageRequest.of(0, pageSize));
            boolean progressed = false;
            for (SpendingRequestEntity request : batch) {
                if (!attempted.add(request.getRequestId())) {
                    continue;
                }
                progressed = true;
                try {
                    if (requestLifecycle.expire(request.getRequestId())) {
                        expired++;
                    } else {
                        skipped++;
                    }
                } catch (Exception e) {
                    failed++;
                    log.error("Failed to expire spending request {}: {}", request.getRequestId(), e.getMessage(), e);
                }
            }
            if (!progressed || batch.size() < pageSize) {
                break;
            }
        }

        if (expired > 0) {
            Counter.builder("governance.sweeper.expired")
                    .register(meterRegistry)
                    .increment(expired);
        }

        int purged = purgeOldData(now);
        return new SweepResult(expired, skipped, failed, purged);
    }

    private int purgeOldData(Instant now) {
        int purged = 0;
        try {
            purged = limitTracker.purgeTrackersEndedBefore(now.minus(properties.getTrackers().getRetention()));
        } catch (Exception e) {
            log.error("Failed to purge old spending limit trackers: {}", e.getMessage(), e);
        }
        try {
            int keys = idempotencyService.purgeExpired(now);
            if (keys > 0) {
                log.debug("Purged {} expired idempotency records", keys);
            }
        } catch (Exception e) {
            log.error("Failed to purge idempotency records: {}", e.getMessage(), e);
        }
        return purged;
    }
}
