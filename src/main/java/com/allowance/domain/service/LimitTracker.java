package com.allowance.domain.service;

import com.allowance.domain.exception.BlockedException;
import com.allowance.domain.model.Amounts;
import com.allowance.domain.model.LimitPeriod;
import com.allowance.domain.model.LimitStatus;
import com.allowance.domain.model.PeriodWindow;
import com.allowance.domain.model.RequestStatus;
import com.allowance.domain.model.SpendingPolicy;
import com.allowance.domain.model.TrackerLookup;
import com.allowance.infrastructure.persistence.entity.SpendingLimit;
import com.allowance.infrastructure.persistence.entity.SpendingLimitTrackerEntity;
import com.allowance.infrastructure.persistence.repository.SpendingLimitTrackerRepository;
import com.allowance.infrastructure.persistence.repository.SpendingRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Running spent/pending totals per child, limit period and window.
 *
 * Mutating methods are called under the child's lock and inside its transaction;
 * a call that touches several windows either updates all of them or, when the
 * transaction rolls back, none.
 *
 * Windows roll over lazily: the first touch of a period after its window ended
 * opens a new tracker. A new window of a limit that counts pending requests
 * starts with the sum of the child's still pending requests, so reservations
 * made in an earlier window keep holding the limit until they are answered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LimitTracker {

    private final SpendingLimitTrackerRepository trackerRepository;
    private final SpendingRequestRepository requestRepository;
    private final Clock clock;

    /**
     * Tracker of the window of {@code limit.period} that contains {@code at},
     * opened from the limit's current amount if it does not exist yet.
     */
    public SpendingLimitTrackerEntity getOrCreateWindow(UUID childId, SpendingLimit limit, Instant at) {
        PeriodWindow window = limit.getPeriod().windowContaining(at);
        return trackerRepository
                .findByChildIdAndPeriodAndPeriodStart(childId, limit.getPeriod(), window.getStart())
                .orElseGet(() -> openWindow(childId, limit, window));
    }

    public TrackerLookup lookupFor(UUID childId, Instant at) {
        return limit -> getOrCreateWindow(childId, limit, at).toSnapshot();
    }

    /**
     * Hold {@code amount} against every limit that counts pending requests.
     */
    public void reserve(UUID childId, SpendingPolicy policy, BigDecimal amount, Instant at) {
        List<SpendingLimitTrackerEntity> trackers = pendingTrackingWindows(childId, policy, at);
        for (SpendingLimitTrackerEntity tracker : trackers) {
            tracker.addPending(amount);
            tracker.setUpdatedAt(at);
        }
        trackerRepository.saveAll(trackers);
        log.debug("Reserved {} for child {} in {} window(s)", amount, childId, trackers.size());
    }

    /**
     * Give back a reservation. Pending totals never go below zero.
     */
    public void release(UUID childId, SpendingPolicy policy, BigDecimal amount, Instant at) {
        List<SpendingLimitTrackerEntity> trackers = pendingTrackingWindows(childId, policy, at);
        for (SpendingLimitTrackerEntity tracker : trackers) {
            BigDecimal unreleased = tracker.releasePending(amount);
            if (unreleased.signum() > 0) {
                log.warn("Release of {} for child {} exceeded pending total of {} window {}; {} ignored",
                        amount, childId, tracker.getPeriod(), tracker.getPeriodStart(), unreleased);
            }
            tracker.setUpdatedAt(at);
        }
        trackerRepository.saveAll(trackers);
        log.debug("Released {} for child {} in {} window(s)", amount, childId, trackers.size());
    }

    /**
     * Record committed spend in every configured limit.
     *
     * @param reserved whether {@code amount} is currently held as a reservation;
     *                 if so it moves from pending to spent, otherwise it is added to spent
     */
    public void commit(UUID childId, SpendingPolicy policy, BigDecimal amount, Instant at, boolean reserved) {
        List<SpendingLimitTrackerEntity> trackers = new ArrayList<>();
        for (SpendingLimit limit : policy.getSpendingLimits().values()) {
            trackers.add(getOrCreateWindow(childId, limit, at));
        }
        for (SpendingLimitTrackerEntity tracker : trackers) {
            if (reserved && tracker.isIncludesPendingRequests()) {
                BigDecimal unreleased = tracker.releasePending(amount);
                if (unreleased.signum() > 0) {
                    log.warn("Commit of {} for child {} found only partial reservation in {} window; {} not held",
                            amount, childId, tracker.getPeriod(), unreleased);
                }
            }
            tracker.addSpent(amount);
            tracker.setUpdatedAt(at);
        }
        trackerRepository.saveAll(trackers);
        log.debug("Committed {} for child {} in {} window(s)", amount, childId, trackers.size());
    }

    /**
     * Approval-time check for limits that ignore pending requests: pending
     * requests never held them, so the committed total is checked here.
     *
     * @throws BlockedException if committing would exceed such a limit
     */
    public void verifyCommit(UUID childId, SpendingPolicy policy, BigDecimal amount, Instant at) {
        for (LimitPeriod period : LimitPeriod.values()) {
            SpendingLimit limit = policy.getSpendingLimits().get(period);
            if (limit == null || limit.isIncludesPendingRequests()) {
                continue;
            }
            SpendingLimitTrackerEntity tracker = getOrCreateWindow(childId, limit, at);
            if (tracker.getSpentAmount().add(amount).compareTo(tracker.getLimitAmount()) > 0) {
                throw new BlockedException("Would exceed " + period.getLabel() + " limit of "
                        + Amounts.format(tracker.getLimitAmount()));
            }
        }
    }

    /**
     * Apply an edited limit to the window that is currently open, if any.
     * Windows that have ended keep their snapshot.
     *
     * The pending total is recomputed from the child's pending requests: while
     * a limit was removed nothing released its reservations, so the stored
     * total cannot be trusted when the limit comes back.
     */
    public void refreshLimit(UUID childId, SpendingLimit limit, Instant at) {
        PeriodWindow window = limit.getPeriod().windowContaining(at);
        trackerRepository.findByChildIdAndPeriodAndPeriodStart(childId, limit.getPeriod(), window.getStart())
                .ifPresent(tracker -> {
                    tracker.setLimitAmount(limit.getLimitAmount());
                    tracker.setIncludesPendingRequests(limit.isIncludesPendingRequests());
                    tracker.setPendingAmount(limit.isIncludesPendingRequests()
                            ? pendingRequestTotal(childId) : BigDecimal.ZERO);
                    tracker.setUpdatedAt(at);
                    trackerRepository.save(tracker);
                    log.info("Refreshed {} window of child {} to limit {}", limit.getPeriod(), childId, limit.getLimitAmount());
                });
    }

    public List<LimitStatus> getStatuses(UUID childId, SpendingPolicy policy, Instant at) {
        List<LimitStatus> statuses = new ArrayList<>();
        for (LimitPeriod period : LimitPeriod.values()) {
            SpendingLimit limit = policy.getSpendingLimits().get(period);
            if (limit == null) {
                continue;
            }
            SpendingLimitTrackerEntity tracker = getOrCreateWindow(childId, limit, at);
            statuses.add(LimitStatus.builder()
                    .period(period)
                    .periodStart(tracker.getPeriodStart())
                    .periodEnd(tracker.getPeriodEnd())
                    .limitAmount(tracker.getLimitAmount())
                    .spentAmount(tracker.getSpentAmount())
                    .pendingAmount(tracker.getPendingAmount())
                    .remainingAmount(tracker.getRemainingAmount())
                    .percentUsed(tracker.getPercentUsed())
                    .includesPendingRequests(tracker.isIncludesPendingRequests())
                    .build());
        }
        return statuses;
    }

    /**
     * Delete trackers of windows that ended before {@code cutoff}.
     */
    @Transactional
    public int purgeTrackersEndedBefore(Instant cutoff) {
        int deleted = trackerRepository.deleteByPeriodEndBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} spending limit trackers ended before {}", deleted, cutoff);
        }
        return deleted;
    }

    private List<SpendingLimitTrackerEntity> pendingTrackingWindows(UUID childId, SpendingPolicy policy, Instant at) {
        List<SpendingLimitTrackerEntity> trackers = new ArrayList<>();
        for (SpendingLimit limit : policy.getSpendingLimits().values()) {
            if (limit.isIncludesPendingRequests()) {
                trackers.add(getOrCreateWindow(childId, limit, at));
            }
        }
        return trackers;
    }

    private SpendingLimitTrackerEntity openWindow(UUID childId, SpendingLimit limit, PeriodWindow window) {
        Instant now = clock.instant();
        BigDecimal carriedPending = limit.isIncludesPendingRequests() && window.contains(now)
                ? pendingRequestTotal(childId)
                : BigDecimal.ZERO;
        SpendingLimitTrackerEntity tracker = SpendingLimitTrackerEntity.builder()
                .trackerId(UUID.randomUUID())
                .childId(childId)
                .period(limit.getPeriod())
                .periodStart(window.getStart())
                .periodEnd(window.getEnd())
                .limitAmount(limit.getLimitAmount())
                .includesPendingRequests(limit.isIncludesPendingRequests())
                .spentAmount(BigDecimal.ZERO)
                .pendingAmount(carriedPending)
                .createdAt(now)
                .updatedAt(now)
                .build();
        trackerRepository.save(tracker);
        log.debug("Opened {} window {} for child {} (limit {}, carried pending {})",
                limit.getPeriod(), window.getStart(), childId, limit.getLimitAmount(), carriedPending);
        return tracker;
    }

    private BigDecimal pendingRequestTotal(UUID childId) {
        return Amounts.zeroIfNull(requestRepository.sumAmountByChildIdAndStatus(childId, RequestStatus.PENDING));
    }
}
