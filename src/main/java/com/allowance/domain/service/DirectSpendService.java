package com.allowance.domain.service;

import com.allowance.domain.exception.BlockedException;
import com.allowance.domain.exception.InvalidStateException;
import com.allowance.domain.exception.ValidationException;
import com.allowance.domain.model.Amounts;
import com.allowance.domain.model.CheckResult;
import com.allowance.domain.model.DirectSpendInput;
import com.allowance.domain.model.DirectSpendResult;
import com.allowance.domain.model.SpendingPolicy;
import com.allowance.domain.port.LedgerReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Purchases that need no parental approval: checked, debited and counted
 * against the limits in one step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DirectSpendService {

    private final PolicyStore policyStore;
    private final SpendingCheckService spendingCheckService;
    private final LimitTracker limitTracker;
    private final LedgerDebitService ledgerDebitService;
    private final ChildLockManager lockManager;
    private final Clock clock;

    /**
     * @throws BlockedException if a policy rule denies the purchase
     * @throws InvalidStateException if the purchase needs approval
     */
    public DirectSpendResult spend(UUID childId, DirectSpendInput input) {
        if (childId == null || input == null) {
            throw new ValidationException("childId and purchase are required");
        }
        BigDecimal amount = Amounts.requirePositive(input.getAmount(), "amount");
        if (input.getDescription() == null || input.getDescription().isBlank()) {
            throw new ValidationException("description is required");
        }

        return lockManager.executeLocked(childId, () -> {
            Instant now = clock.instant();
            SpendingPolicy policy = policyStore.getPolicy(childId);
            CheckResult check = spendingCheckService.evaluate(policy, amount, input.getCategoryId(), now);
            if (!check.isCanSpend()) {
                throw new BlockedException(check.getBlockReason());
            }
            if (check.isRequiresApproval()) {
                throw new InvalidStateException("This purchase needs parental approval; create a spending request instead");
            }

            LedgerReceipt receipt = ledgerDebitService.debit(
                    childId, amount, input.getDescription().trim(), input.getCategoryId());
            limitTracker.commit(childId, policy, amount, now, false);

            log.info("Direct purchase of {} by child {} recorded (transaction {})",
                    amount, childId, receipt.getTransactionId());
            return DirectSpendResult.builder()
                    .transactionId(receipt.getTransactionId())
                    .newBalance(receipt.getNewBalance())
                    .warnings(check.getWarnings())
                    .build();
        });
    }
}
