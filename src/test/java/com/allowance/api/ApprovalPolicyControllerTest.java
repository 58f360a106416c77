package com.allowance.api;

import com.allowance.domain.exception.NotFoundException;
import com.allowance.domain.model.CategoryRestriction;
import com.allowance.domain.model.LimitPeriod;
import com.allowance.domain.model.SpendingPolicy;
import com.allowance.domain.service.PolicyStore;
import com.allowance.infrastructure.persistence.entity.CategoryRule;
import com.allowance.infrastructure.persistence.entity.SpendingLimit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class ApprovalPolicyControllerTest {

    @Mock private PolicyStore policyStore;

    private MockMvc mockMvc;
    private UUID childId;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ApprovalPolicyController(policyStore))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        childId = UUID.randomUUID();
    }

    @Test
    void upsertCategoryRule_takesCategoryFromPath() throws Exception {
        when(policyStore.upsertCategoryRule(eq(childId), any(CategoryRule.class))).thenReturn(policy());

        mockMvc.perform(put("/api/v1/children/{childId}/approval-settings/category-rules/{categoryId}", childId, "candy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"restriction\":\"BLOCKED\",\"restrictionReason\":\"No candy purchases\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<CategoryRule> captor = ArgumentCaptor.forClass(CategoryRule.class);
        verify(policyStore).upsertCategoryRule(eq(childId), captor.capture());
        assertEquals("candy", captor.getValue().getCategoryId());
        assertEquals(CategoryRestriction.BLOCKED, captor.getValue().getRestriction());
    }

    @Test
    void upsertSpendingLimit_defaultsToCountingPendingRequests() throws Exception {
        when(policyStore.upsertSpendingLimit(eq(childId), any(SpendingLimit.class))).thenReturn(policy());

        mockMvc.perform(put("/api/v1/children/{childId}/approval-settings/spending-limits/{period}", childId, "WEEKLY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limitAmount\":20.00}"))
                .andExpect(status().isOk());

        ArgumentCaptor<SpendingLimit> captor = ArgumentCaptor.forClass(SpendingLimit.class);
        verify(policyStore).upsertSpendingLimit(eq(childId), captor.capture());
        assertEquals(LimitPeriod.WEEKLY, captor.getValue().getPeriod());
        assertTrue(captor.getValue().isIncludesPendingRequests());
    }

    @Test
    void upsertSpendingLimit_negativeAmount_is400() throws Exception {
        mockMvc.perform(put("/api/v1/children/{childId}/approval-settings/spending-limits/{period}", childId, "DAILY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limitAmount\":-5}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(policyStore);
    }

    @Test
    void removeMissingLimit_is404() throws Exception {
        when(policyStore.removeSpendingLimit(childId, LimitPeriod.MONTHLY))
                .thenThrow(new NotFoundException("No monthly spending limit configured"));

        mockMvc.perform(delete("/api/v1/children/{childId}/approval-settings/spending-limits/{period}", childId, "MONTHLY"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void pause_returnsPolicy() throws Exception {
        when(policyStore.setPaused(childId, "Grounded")).thenReturn(policy());

        mockMvc.perform(post("/api/v1/children/{childId}/approval-settings/pause", childId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Grounded\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.childId").value(childId.toString()));
    }

    private SpendingPolicy policy() {
        return SpendingPolicy.builder()
                .childId(childId)
                .enabled(true)
                .approvalThreshold(new BigDecimal("10.00"))
                .autoApproveUnderThreshold(true)
                .trustedCategoryIds(Set.of())
                .requestExpirationHours(72)
                .categoryRules(Map.of())
                .spendingLimits(Map.of())
                .build();
    }
}
