package com.allowance.infrastructure.messaging;

import com.allowance.domain.port.Notifier;
import com.allowance.infrastructure.persistence.entity.OutboxEventEntity;
import com.allowance.infrastructure.persistence.repository.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Queues notifications in the outbox table for {@code OutboxPublisher}.
 *
 * Any failure is logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxNotifier implements Notifier {

    static final String FAMILY_NOTIFICATION = "FAMILY_NOTIFICATION";
    static final String CHILD_NOTIFICATION = "CHILD_NOTIFICATION";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void notifyFamily(UUID familyId, String message, Map<String, Object> payload) {
        enqueue(FAMILY_NOTIFICATION, familyId, message, payload);
    }

    @Override
    public void notifyChild(UUID childId, String message, Map<String, Object> payload) {
        enqueue(CHILD_NOTIFICATION, childId, message, payload);
    }

    private void enqueue(String eventType, UUID recipientId, String message, Map<String, Object> payload) {
        try {
            Instant now = clock.instant();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("type", eventType);
            body.put("recipientId", recipientId.toString());
            body.put("message", message);
            body.put("payload", payload);
            body.put("createdAt", now.toString());

            OutboxEventEntity event = OutboxEventEntity.builder()
                    .eventId(UUID.randomUUID())
                    .eventType(eventType)
                    .aggregateId(recipientId.toString())
                    .payload(objectMapper.writeValueAsString(body))
                    .createdAt(now)
                    .build();
            outboxEventRepository.save(event);

            log.debug("Queued {} for {}", eventType, recipientId);
        } catch (Exception e) {
            log.error("Failed to queue {} for {}: {}", eventType, recipientId, e.getMessage(), e);
        }
    }
}
