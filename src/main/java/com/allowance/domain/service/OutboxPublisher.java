package com.allowance.domain.service;

import com.allowance.infrastructure.persistence.entity.OutboxEventEntity;
import com.allowance.infrastructure.persistence.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes queued notifications from the outbox table to Kafka.
 *
 * A failed publish leaves the event pending for the next poll until it has
 * failed {@code app.outbox.max-attempts} times. Consumers must tolerate duplicates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Clock clock;

    @Value("${app.kafka.topics.notifications}")
    private String notificationsTopic;

    @Value("${app.outbox.batch-size:10}")
    private int batchSize;

    @Value("${app.outbox.max-attempts:5}")
    private int maxAttempts;

    @Value("${app.outbox.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${app.outbox.polling-interval-ms:1000}")
    @Transactional
    public void publishPendingEvents() {
        try {
            int published = publishBatch();
            if (published > 0) {
                log.debug("Published {} outbox events", published);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of events published
     */
    public int publishBatch() {
        List<OutboxEventEntity> pendingEvents = outboxEventRepository
                .findByStatusOrderByCreatedAtAsc(OutboxEventEntity.EventStatus.PENDING, PageRequest.of(0, batchSize));

        int published = 0;
        for (OutboxEventEntity event : pendingEvents) {
            try {
                kafkaTemplate.send(notificationsTopic, event.getAggregateId(), event.getPayload())
                        .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
                event.markPublished(clock.instant());
                published++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                event.markFailed("interrupted", maxAttempts);
                outboxEventRepository.save(event);
                break;
            } catch (ExecutionException | TimeoutException e) {
                event.markFailed(e.getMessage(), maxAttempts);
                log.error("Failed to publish outbox event {} (attempt {}): {}",
                        event.getEventId(), event.getRetryCount(), e.getMessage());
            }
            outboxEventRepository.save(event);
        }
        return published;
    }
}
