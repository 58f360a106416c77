package com.allowance.api;

import com.allowance.api.dto.SpendingCheckRequest;
import com.allowance.domain.model.CheckResult;
import com.allowance.domain.model.CreateRequestInput;
import com.allowance.domain.model.DirectSpendInput;
import com.allowance.domain.model.DirectSpendResult;
import com.allowance.domain.model.LimitStatus;
import com.allowance.domain.model.RequestStatistics;
import com.allowance.domain.model.RequestStatus;
import com.allowance.domain.model.RespondInput;
import com.allowance.domain.service.DirectSpendService;
import com.allowance.domain.service.RequestLifecycle;
import com.allowance.domain.service.SpendingCheckService;
import com.allowance.domain.service.SpendingRequestQueryService;
import com.allowance.infrastructure.persistence.entity.SpendingRequestEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for spending checks, spending requests and limit usage.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SpendingRequestController {

    private final SpendingCheckService spendingCheckService;
    private final RequestLifecycle requestLifecycle;
    private final DirectSpendService directSpendService;
    private final SpendingRequestQueryService queryService;

    @PostMapping("/children/{childId}/spending-checks")
    public ResponseEntity<CheckResult> checkSpending(@PathVariable UUID childId,
                                                     @Valid @RequestBody SpendingCheckRequest request) {
        return ResponseEntity.ok(spendingCheckService.checkSpending(childId, request.getAmount(), request.getCategoryId()));
    }

    /**
     * POST /api/v1/children/{childId}/spending-requests
     *
     * Clients retrying after a 503 send the same Idempotency-Key.
     */
    @PostMapping("/children/{childId}/spending-requests")
    public ResponseEntity<SpendingRequestEntity> createRequest(
            @PathVariable UUID childId,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody CreateRequestInput input) {
        log.info("Received spending request from child {}", childId);
        SpendingRequestEntity created = requestLifecycle.create(childId, input, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/children/{childId}/spending-requests")
    public ResponseEntity<List<SpendingRequestEntity>> listRequests(
            @PathVariable UUID childId,
            @RequestParam(required = false) RequestStatus status) {
        return ResponseEntity.ok(queryService.listForChild(childId, status));
    }

    @GetMapping("/children/{childId}/spending-requests/statistics")
    public ResponseEntity<RequestStatistics> statistics(@PathVariable UUID childId) {
        return ResponseEntity.ok(queryService.getStatistics(childId));
    }

    @PostMapping("/children/{childId}/spending-requests/{requestId}/cancel")
    public ResponseEntity<SpendingRequestEntity> cancelRequest(@PathVariable UUID childId,
                                                               @PathVariable UUID requestId) {
        return ResponseEntity.ok(requestLifecycle.cancel(requestId, childId));
    }

    @PostMapping("/children/{childId}/purchases")
    public ResponseEntity<DirectSpendResult> spend(@PathVariable UUID childId,
                                                   @Valid @RequestBody DirectSpendInput input) {
        return ResponseEntity.ok(directSpendService.spend(childId, input));
    }

    @GetMapping("/children/{childId}/limit-statuses")
    public ResponseEntity<List<LimitStatus>> limitStatuses(@PathVariable UUID childId) {
        return ResponseEntity.ok(spendingCheckService.getLimitStatuses(childId));
    }

    @GetMapping("/spending-requests/{requestId}")
    public ResponseEntity<SpendingRequestEntity> getRequest(@PathVariable UUID requestId) {
        return ResponseEntity.ok(queryService.getRequest(requestId));
    }

    @PostMapping("/spending-requests/{requestId}/response")
    public ResponseEntity<SpendingRequestEntity> respond(@PathVariable UUID requestId,
                                                         @Valid @RequestBody RespondInput input) {
        log.info("Received {} for spending request {}", input.isApproved() ? "approval" : "denial", requestId);
        return ResponseEntity.ok(requestLifecycle.respond(requestId, input));
    }

    @GetMapping("/families/{familyId}/spending-requests/pending")
    public ResponseEntity<List<SpendingRequestEntity>> pendingForFamily(@PathVariable UUID familyId) {
        return ResponseEntity.ok(queryService.listPendingForFamily(familyId));
    }
}
