package com.allowance.domain.service;

import com.allowance.config.GovernanceProperties;
import com.allowance.domain.exception.ValidationException;
import com.allowance.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.allowance.infrastructure.persistence.repository.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Duplicate detection for spending request creation.
 *
 * A client that retries a create after a timeout sends the same idempotency key
 * and gets the request created by the first attempt, so the amount is reserved once.
 * Keys are kept for {@code governance.idempotency.window}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final IdempotencyRecordRepository idempotencyRepository;
    private final GovernanceProperties properties;
    private final Clock clock;

    /**
     * Request previously created with this key, if the key is still live.
     *
     * @throws ValidationException if the key was used by another child
     */
    public Optional<UUID> checkDuplicate(String idempotencyKey, UUID childId) {
        Optional<IdempotencyRecordEntity> record = idempotencyRepository.findByIdempotencyKey(idempotencyKey);
        if (record.isEmpty()) {
            return Optional.empty();
        }

        IdempotencyRecordEntity entity = record.get();
        if (entity.isExpired(clock.instant())) {
            log.debug("Idempotency record expired for key: {}", idempotencyKey);
            idempotencyRepository.delete(entity);
            idempotencyRepository.flush();
            return Optional.empty();
        }
        if (!entity.getChildId().equals(childId)) {
            throw new ValidationException("Idempotency key already used");
        }

        log.info("Duplicate create request detected for key: {}", idempotencyKey);
        return Optional.of(entity.getRequestId());
    }

    public void storeIdempotencyRecord(String idempotencyKey, UUID childId, UUID requestId) {
        Instant now = clock.instant();
        IdempotencyRecordEntity record = IdempotencyRecordEntity.builder()
                .recordId(UUID.randomUUID())
                .idempotencyKey(idempotencyKey)
                .childId(childId)
                .requestId(requestId)
                .createdAt(now)
                .expiresAt(now.plus(properties.getIdempotency().getWindow()))
                .build();
        idempotencyRepository.save(record);
        log.debug("Stored idempotency record for key: {}", idempotencyKey);
    }

    @Transactional
    public int purgeExpired(Instant now) {
        return idempotencyRepository.deleteExpired(now);
    }
}
