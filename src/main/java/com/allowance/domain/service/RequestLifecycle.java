package com.allowance.domain.service;

import com.allowance.domain.exception.BlockedException;
import com.allowance.domain.exception.InvalidStateException;
import com.allowance.domain.exception.NotFoundException;
import com.allowance.domain.exception.ValidationException;
import com.allowance.domain.model.Amounts;
import com.allowance.domain.model.CheckResult;
import com.allowance.domain.model.CreateRequestInput;
import com.allowance.domain.model.RequestStatus;
import com.allowance.domain.model.RequestTransition;
import com.allowance.domain.model.RespondInput;
import com.allowance.domain.model.SpendingPolicy;
import com.allowance.domain.port.LedgerReceipt;
import com.allowance.domain.port.Notifier;
import com.allowance.infrastructure.persistence.entity.SpendingRequestEntity;
import com.allowance.infrastructure.persistence.repository.SpendingRequestRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Spending request state machine.
 *
 * PENDING -> APPROVED | DENIED | CANCELLED | EXPIRED, all terminal.
 *
 * Creation reserves the amount against the child's limits; every transition
 * out of PENDING either commits (approval) or releases (everything else) that
 * reservation. Each transition re-reads the request and checks that it is
 * still pending while holding the child's lock, so of several concurrent
 * transitions on one request exactly one succeeds.
 *
 * Notifications are sent after the transaction commits and never fail an operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestLifecycle {

    private static final int MAX_DESCRIPTION_LENGTH = 500;
    private static final int MAX_COMMENT_LENGTH = 1000;

    private final SpendingRequestRepository requestRepository;
    private final PolicyStore policyStore;
    private final SpendingCheckService spendingCheckService;
    private final LimitTracker limitTracker;
    private final LedgerDebitService ledgerDebitService;
    private final IdempotencyService idempotencyService;
    private final ChildLockManager lockManager;
    private final Notifier notifier;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public SpendingRequestEntity create(UUID childId, CreateRequestInput input) {
        return create(childId, input, null);
    }

    /**
     * Create a pending request and reserve its amount.
     *
     * @param idempotencyKey optional; a repeated key returns the request created the first time
     * @throws BlockedException if a policy rule denies the purchase
     * @throws ValidationException if the input is invalid or the purchase needs no approval
     */
    public SpendingRequestEntity create(UUID childId, CreateRequestInput input, String idempotencyKey) {
        if (childId == null) {
            throw new ValidationException("childId is required");
        }
        if (input == null) {
            throw new ValidationException("Request input is required");
        }
        if (input.getFamilyId() == null) {
            throw new ValidationException("familyId is required");
        }
        BigDecimal amount = Amounts.requirePositive(input.getAmount(), "amount");
        String description = requireDescription(input.getDescription());
        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;

        Creation creation = lockManager.executeLocked(childId, () -> {
            if (key != null) {
                Optional<UUID> existing = idempotencyService.checkDuplicate(key, childId);
                if (existing.isPresent()) {
                    return new Creation(findRequest(existing.get()), true);
                }
            }

            Instant now = clock.instant();
            SpendingPolicy policy = policyStore.getPolicy(childId);
            CheckResult check = spendingCheckService.evaluate(policy, amount, input.getCategoryId(), now);
            if (!check.isCanSpend()) {
                throw new BlockedException(check.getBlockReason());
            }
            if (!check.isRequiresApproval()) {
                throw new ValidationException("This purchase does not require approval; spend directly instead");
            }

            limitTracker.reserve(childId, policy, amount, now);

            SpendingRequestEntity request = SpendingRequestEntity.builder()
                    .requestId(UUID.randomUUID())
                    .childId(childId)
                    .familyId(input.getFamilyId())
                    .amount(amount)
                    .description(description)
                    .categoryId(input.getCategoryId())
                    .wishListItemId(input.getWishListItemId())
                    .status(RequestStatus.PENDING)
                    .createdAt(now)
                    .expiresAt(now.plus(policy.getRequestExpirationHours(), ChronoUnit.HOURS))
                    .build();
            requestRepository.save(request);

            if (key != null) {
                idempotencyService.storeIdempotencyRecord(key, childId, request.getRequestId());
            }
            return new Creation(request, false);
        });

        SpendingRequestEntity request = creation.getRequest();
        if (creation.isReplayed()) {
            return request;
        }

        Counter.builder("governance.request.created")
                .register(meterRegistry)
                .increment();
        log.info("Spending request {} created: child {}, amount {}, expires {}",
                request.getRequestId(), childId, amount, request.getExpiresAt());

        notifySafely(() -> notifier.notifyFamily(request.getFamilyId(),
                "Spending request for " + Amounts.format(amount) + " needs approval: " + description,
                payload(request)));
        return request;
    }

    /**
     * A parent approves or denies a pending request.
     *
     * On approval the ledger debit happens first; if it fails nothing changes
     * and the request stays pending with its reservation in place.
     *
     * @throws InvalidStateException if the request is no longer pending
     */
    public SpendingRequestEntity respond(UUID requestId, RespondInput input) {
        if (input == null || input.getRespondedBy() == null) {
            throw new ValidationException("respondedBy is required");
        }
        if (input.getComment() != null && input.getComment().length() > MAX_COMMENT_LENGTH) {
            throw new ValidationException("comment cannot exceed " + MAX_COMMENT_LENGTH + " characters");
        }
        UUID childId = findRequest(requestId).getChildId();
        RequestTransition transition = input.isApproved() ? RequestTransition.APPROVE : RequestTransition.DENY;

        SpendingRequestEntity answered = lockManager.executeLocked(childId, () -> {
            SpendingRequestEntity request = findRequest(requestId);
            requirePending(request);
            Instant now = clock.instant();
            SpendingPolicy policy = policyStore.getPolicy(childId);

            if (transition == RequestTransition.APPROVE) {
                limitTracker.verifyCommit(childId, policy, request.getAmount(), now);
                LedgerReceipt receipt = ledgerDebitService.debit(
                        childId, request.getAmount(), request.getDescription(), request.getCategoryId());
                request.setTransactionId(receipt.getTransactionId());
            }

            applyTransition(request, transition, policy, now);
            request.setRespondedBy(input.getRespondedBy());
            request.setParentComment(input.getComment());
            request.setLearningMoment(input.isLearningMoment());
            requestRepository.save(request);
            return request;
        });

        String outcome = transition == RequestTransition.APPROVE ? "approved" : "denied";
        notifySafely(() -> notifier.notifyChild(answered.getChildId(),
                "Your request for " + Amounts.format(answered.getAmount()) + " was " + outcome,
                payload(answered)));
        return answered;
    }

    /**
     * The requesting child withdraws a pending request.
     */
    public SpendingRequestEntity cancel(UUID requestId, UUID callerChildId) {
        SpendingRequestEntity found = findRequest(requestId);
        if (!found.getChildId().equals(callerChildId)) {
            throw new ValidationException("Only the child who made the request can cancel it");
        }

        SpendingRequestEntity cancelled = lockManager.executeLocked(found.getChildId(), () -> {
            SpendingRequestEntity request = findRequest(requestId);
            requirePending(request);
            Instant now = clock.instant();
            applyTransition(request, RequestTransition.CANCEL, policyStore.getPolicy(request.getChildId()), now);
            requestRepository.save(request);
            return request;
        });

        notifySafely(() -> notifier.notifyFamily(cancelled.getFamilyId(),
                "Spending request for " + Amounts.format(cancelled.getAmount()) + " was cancelled",
                payload(cancelled)));
        return cancelled;
    }

    /**
     * Expire a request whose deadline has passed. Requests that are no longer
     * pending, or not yet due, are left alone.
     *
     * @return whether this call expired the request
     */
    public boolean expire(UUID requestId) {
        Optional<SpendingRequestEntity> found = requestRepository.findById(requestId);
        if (found.isEmpty()) {
            log.debug("Spending request {} vanished before expiry", requestId);
            return false;
        }

        SpendingRequestEntity expired = lockManager.executeLocked(found.get().getChildId(), () -> {
            SpendingRequestEntity request = requestRepository.findById(requestId).orElse(null);
            Instant now = clock.instant();
            if (request == null || !request.isPending() || !request.isOverdue(now)) {
                return null;
            }
            applyTransition(request, RequestTransition.EXPIRE, policyStore.getPolicy(request.getChildId()), now);
            requestRepository.save(request);
            return request;
        });

        if (expired == null) {
            log.debug("Spending request {} not expired: no longer pending or not yet due", requestId);
            return false;
        }
        notifySafely(() -> notifier.notifyChild(expired.getChildId(),
                "Your request for " + Amounts.format(expired.getAmount()) + " expired without an answer",
                payload(expired)));
        return true;
    }

    private void applyTransition(SpendingRequestEntity request, RequestTransition transition,
                                 SpendingPolicy policy, Instant now) {
        request.apply(transition, now);
        switch (transition.reservationEffect()) {
            case COMMIT -> limitTracker.commit(request.getChildId(), policy, request.getAmount(), now, true);
            case RELEASE -> limitTracker.release(request.getChildId(), policy, request.getAmount(), now);
        }

        Counter.builder("governance.request.transition")
                .tag("transition", transition.name().toLowerCase())
                .register(meterRegistry)
                .increment();
        log.info("Spending request {} of child {}: {} -> {}",
                request.getRequestId(), request.getChildId(), RequestStatus.PENDING, request.getStatus());
    }

    private SpendingRequestEntity findRequest(UUID requestId) {
        if (requestId == null) {
            throw new ValidationException("requestId is required");
        }
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Spending request not found: " + requestId));
    }

    private static void requirePending(SpendingRequestEntity request) {
        if (!request.isPending()) {
            throw new InvalidStateException("Spending request " + request.getRequestId()
                    + " is no longer pending (" + request.getStatus() + ")");
        }
    }

    private static String requireDescription(String description) {
        if (description == null || description.isBlank()) {
            throw new ValidationException("description is required");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description cannot exceed " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description.trim();
    }

    private static Map<String, Object> payload(SpendingRequestEntity request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", request.getRequestId().toString());
        payload.put("childId", request.getChildId().toString());
        payload.put("amount", request.getAmount());
        payload.put("description", request.getDescription());
        payload.put("status", request.getStatus().name());
        if (request.getCategoryId() != null) {
            payload.put("categoryId", request.getCategoryId());
        }
        if (request.getParentComment() != null) {
            payload.put("parentComment", request.getParentComment());
            payload.put("learningMoment", request.isLearningMoment());
        }
        return payload;
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.error("Notification failed: {}", e.getMessage(), e);
        }
    }

    @Value
    private static class Creation {
        SpendingRequestEntity request;
        boolean replayed;
    }
}
