package com.allowance.domain.service;

import com.allowance.domain.model.Amounts;
import com.allowance.domain.model.CheckResult;
import com.allowance.domain.model.LimitStatus;
import com.allowance.domain.model.SpendingPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for "can I spend this?" and limit usage queries.
 *
 * Loads the child's policy, opens missing limit windows under the child lock
 * and hands both to {@link RuleEvaluator}. Never reserves anything.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpendingCheckService {

    private final PolicyStore policyStore;
    private final LimitTracker limitTracker;
    private final RuleEvaluator ruleEvaluator;
    private final ChildLockManager lockManager;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CheckResult checkSpending(UUID childId, BigDecimal amount, String categoryId) {
        BigDecimal validAmount = Amounts.requirePositive(amount, "amount");
        Timer.Sample sample = Timer.start(meterRegistry);

        CheckResult result = lockManager.executeLocked(childId, () ->
                evaluate(policyStore.getPolicy(childId), validAmount, categoryId, clock.instant()));

        sample.stop(Timer.builder("governance.check.latency").register(meterRegistry));
        return result;
    }

    /**
     * Evaluate against an already loaded policy. Callers hold the child's lock.
     */
    public CheckResult evaluate(SpendingPolicy policy, BigDecimal amount, String categoryId, Instant now) {
        CheckResult result = ruleEvaluator.evaluate(policy, amount, categoryId,
                limitTracker.lookupFor(policy.getChildId(), now));

        String outcome = !result.isCanSpend() ? "blocked"
                : result.isRequiresApproval() ? "approval_required" : "allowed";
        Counter.builder("governance.check")
                .tag("result", outcome)
                .register(meterRegistry)
                .increment();

        if (!result.isCanSpend()) {
            log.info("Spending of {} by child {} in category {} blocked: {}",
                    amount, policy.getChildId(), categoryId, result.getBlockReason());
        }
        return result;
    }

    public List<LimitStatus> getLimitStatuses(UUID childId) {
        return lockManager.executeLocked(childId, () ->
                limitTracker.getStatuses(childId, policyStore.getPolicy(childId), clock.instant()));
    }
}
