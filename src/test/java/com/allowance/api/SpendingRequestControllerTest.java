package com.allowance.api;

import com.allowance.domain.exception.BlockedException;
import com.allowance.domain.exception.InsufficientFundsException;
import com.allowance.domain.exception.InvalidStateException;
import com.allowance.domain.exception.NotFoundException;
import com.allowance.domain.exception.TransientException;
import com.allowance.domain.model.CheckResult;
import com.allowance.domain.model.CreateRequestInput;
import com.allowance.domain.model.RequestStatus;
import com.allowance.domain.model.RespondInput;
import com.allowance.domain.service.DirectSpendService;
import com.allowance.domain.service.RequestLifecycle;
import com.allowance.domain.service.SpendingCheckService;
import com.allowance.domain.service.SpendingRequestQueryService;
import com.allowance.infrastructure.persistence.entity.SpendingRequestEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class SpendingRequestControllerTest {

    @Mock private SpendingCheckService spendingCheckService;
    @Mock private RequestLifecycle requestLifecycle;
    @Mock private DirectSpendService directSpendService;
    @Mock private SpendingRequestQueryService queryService;

    private MockMvc mockMvc;
    private UUID childId;

    @BeforeEach
    void setUp() {
        SpendingRequestController controller = new SpendingRequestController(
                spendingCheckService, requestLifecycle, directSpendService, queryService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        childId = UUID.randomUUID();
    }

    @Test
    void checkSpending_returnsResult() throws Exception {
        when(spendingCheckService.checkSpending(childId, new BigDecimal("10.01"), null))
                .thenReturn(CheckResult.allowed(true, List.of()));

        mockMvc.perform(post("/api/v1/children/{childId}/spending-checks", childId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":10.01}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.canSpend").value(true))
                .andExpect(jsonPath("$.requiresApproval").value(true));
    }

    @Test
    void createRequest_passesIdempotencyKey() throws Exception {
        UUID familyId = UUID.randomUUID();
        SpendingRequestEntity created = SpendingRequestEntity.builder()
                .requestId(UUID.randomUUID())
                .childId(childId)
                .familyId(familyId)
                .amount(new BigDecimal("15.00"))
                .description("Lego set")
                .status(RequestStatus.PENDING)
                .createdAt(Instant.parse("2026-03-11T10:00:00Z"))
                .expiresAt(Instant.parse("2026-03-14T10:00:00Z"))
                .build();
        when(requestLifecycle.create(eq(childId), any(CreateRequestInput.class), eq("retry-1"))).thenReturn(created);

        mockMvc.perform(post("/api/v1/children/{childId}/spending-requests", childId)
                        .header("Idempotency-Key", "retry-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"familyId\":\"" + familyId + "\",\"amount\":15.00,\"description\":\"Lego set\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void createRequest_invalidBody_is400() throws Exception {
        mockMvc.perform(post("/api/v1/children/{childId}/spending-requests", childId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":-1,\"description\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(requestLifecycle);
    }

    @Test
    void createRequest_blocked_is422() throws Exception {
        when(requestLifecycle.create(eq(childId), any(CreateRequestInput.class), isNull()))
                .thenThrow(new BlockedException("Would exceed weekly limit of $20.00 ($5.00 remaining)"));

        mockMvc.perform(post("/api/v1/children/{childId}/spending-requests", childId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"familyId\":\"" + UUID.randomUUID() + "\",\"amount\":25.00,\"description\":\"Bike\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("SPENDING_BLOCKED"))
                .andExpect(jsonPath("$.message").value("Would exceed weekly limit of $20.00 ($5.00 remaining)"));
    }

    @Test
    void respond_errorsMapToStatuses() throws Exception {
        UUID requestId = UUID.randomUUID();
        String body = "{\"approved\":true,\"respondedBy\":\"" + UUID.randomUUID() + "\"}";

        when(requestLifecycle.respond(eq(requestId), any(RespondInput.class)))
                .thenThrow(new InvalidStateException("no longer pending"))
                .thenThrow(new InsufficientFundsException("Insufficient funds"))
                .thenThrow(new TransientException("Ledger temporarily unavailable"))
                .thenThrow(new NotFoundException("Spending request not found"));

        mockMvc.perform(post("/api/v1/spending-requests/{requestId}/response", requestId)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict());
        mockMvc.perform(post("/api/v1/spending-requests/{requestId}/response", requestId)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/api/v1/spending-requests/{requestId}/response", requestId)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isServiceUnavailable());
        mockMvc.perform(post("/api/v1/spending-requests/{requestId}/response", requestId)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound());
    }

    @Test
    void cancel_usesPathChildAsCaller() throws Exception {
        UUID requestId = UUID.randomUUID();
        when(requestLifecycle.cancel(requestId, childId)).thenReturn(SpendingRequestEntity.builder()
                .requestId(requestId)
                .childId(childId)
                .status(RequestStatus.CANCELLED)
                .build());

        mockMvc.perform(post("/api/v1/children/{childId}/spending-requests/{requestId}/cancel", childId, requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    void listRequests_filtersByStatus() throws Exception {
        when(queryService.listForChild(childId, RequestStatus.PENDING)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/children/{childId}/spending-requests", childId).param("status", "PENDING"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
