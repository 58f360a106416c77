package com.allowance.domain.service;

import com.allowance.domain.exception.NotFoundException;
import com.allowance.domain.model.Amounts;
import com.allowance.domain.model.RequestStatistics;
import com.allowance.domain.model.RequestStatus;
import com.allowance.infrastructure.persistence.entity.SpendingRequestEntity;
import com.allowance.infrastructure.persistence.repository.SpendingRequestRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of spending requests for child history and parent inboxes.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SpendingRequestQueryService {

    private final SpendingRequestRepository requestRepository;

    public SpendingRequestEntity getRequest(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Spending request not found: " + requestId));
    }

    /**
     * Requests of a child, newest first, optionally of one status.
     */
    public List<SpendingRequestEntity> listForChild(UUID childId, RequestStatus status) {
        if (status == null) {
            return requestRepository.findByChildIdOrderByCreatedAtDesc(childId);
        }
        return requestRepository.findByChildIdAndStatusOrderByCreatedAtDesc(childId, status);
    }

    /**
     * Requests waiting for a parent of the family, oldest first.
     */
    public List<SpendingRequestEntity> listPendingForFamily(UUID familyId) {
        return requestRepository.findByFamilyIdAndStatusOrderByCreatedAtAsc(familyId, RequestStatus.PENDING);
    }

    public RequestStatistics getStatistics(UUID childId) {
        Map<RequestStatus, Long> counts = new EnumMap<>(RequestStatus.class);
        long total = 0;
        for (RequestStatus status : RequestStatus.values()) {
            long count = requestRepository.countByChildIdAndStatus(childId, status);
            counts.put(status, count);
            total += count;
        }

        long approved = counts.get(RequestStatus.APPROVED);
        long denied = counts.get(RequestStatus.DENIED);
        BigDecimal approvalRate = approved + denied == 0 ? BigDecimal.ZERO
                : BigDecimal.valueOf(approved).divide(BigDecimal.valueOf(approved + denied), 4, RoundingMode.HALF_UP);

        return RequestStatistics.builder()
                .childId(childId)
                .total(total)
                .pending(counts.get(RequestStatus.PENDING))
                .approved(approved)
                .denied(denied)
                .cancelled(counts.get(RequestStatus.CANCELLED))
                .expired(counts.get(RequestStatus.EXPIRED))
                .approvalRate(approvalRate)
                .approvedAmount(Amounts.zeroIfNull(
                        requestRepository.sumAmountByChildIdAndStatus(childId, RequestStatus.APPROVED)))
                .build();
    }
}
