package com.allowance.domain.service;

import com.allowance.infrastructure.persistence.entity.OutboxEventEntity;
import com.allowance.infrastructure.persistence.repository.OutboxEventRepository;
import com.allowance.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-11T10:00:00Z");

    @Mock private OutboxEventRepository outboxEventRepository;
    @Mock private KafkaTemplate<String, String> kafkaTemplate;

    private OutboxPublisher outboxPublisher;

    @BeforeEach
    void setUp() {
        outboxPublisher = new OutboxPublisher(outboxEventRepository, kafkaTemplate, new MutableClock(NOW));
        ReflectionTestUtils.setField(outboxPublisher, "notificationsTopic", "allowance.notifications");
        ReflectionTestUtils.setField(outboxPublisher, "batchSize", 10);
        ReflectionTestUtils.setField(outboxPublisher, "maxAttempts", 2);
        ReflectionTestUtils.setField(outboxPublisher, "sendTimeoutMs", 1000L);
    }

    @Test
    void publishBatch_sendsAndMarksPublished() {
        OutboxEventEntity event = pendingEvent();
        when(outboxEventRepository.findByStatusOrderByCreatedAtAsc(eq(OutboxEventEntity.EventStatus.PENDING), any()))
                .thenReturn(List.of(event));
        CompletableFuture<SendResult<String, String>> sent = CompletableFuture.completedFuture(null);
        when(kafkaTemplate.send("allowance.notifications", event.getAggregateId(), event.getPayload())).thenReturn(sent);

        assertEquals(1, outboxPublisher.publishBatch());

        assertEquals(OutboxEventEntity.EventStatus.PUBLISHED, event.getStatus());
        assertEquals(NOW, event.getPublishedAt());
        verify(outboxEventRepository).save(event);
    }

    @Test
    void publishBatch_failure_retriesUntilMaxAttempts() {
        OutboxEventEntity event = pendingEvent();
        when(outboxEventRepository.findByStatusOrderByCreatedAtAsc(eq(OutboxEventEntity.EventStatus.PENDING), any()))
                .thenReturn(List.of(event));
        CompletableFuture<SendResult<String, String>> failed = CompletableFuture.failedFuture(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(failed);

        assertEquals(0, outboxPublisher.publishBatch());
        assertEquals(OutboxEventEntity.EventStatus.PENDING, event.getStatus());
        assertEquals(1, event.getRetryCount());

        outboxPublisher.publishBatch();
        assertEquals(OutboxEventEntity.EventStatus.FAILED, event.getStatus());
        assertNotNull(event.getErrorMessage());
    }

    private static OutboxEventEntity pendingEvent() {
        return OutboxEventEntity.builder()
                .eventId(UUID.randomUUID())
                .eventType("CHILD_NOTIFICATION")
                .aggregateId(UUID.randomUUID().toString())
                .payload("{\"message\":\"Your request for $15.00 was approved\"}")
                .createdAt(NOW)
                .retryCount(0)
                .build();
    }
}
