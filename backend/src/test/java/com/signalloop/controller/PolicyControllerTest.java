package com.signalloop.controller;

import com.signalloop.model.ControlPlaneSnapshot;
import com.signalloop.model.PolicyUpdateResult;
import com.signalloop.service.ControlPlaneService;
import com.signalloop.service.PolicyUpdateException;
import com.signalloop.service.PolicyUpdaterService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PolicyController.class)
class PolicyControllerTest {

    private static final OffsetDateTime EFFECTIVE_AT = OffsetDateTime.of(2026, 3, 2, 0, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ControlPlaneService controlPlaneService;

    @MockitoBean
    private PolicyUpdaterService policyUpdaterService;

    private static ControlPlaneSnapshot snapshot(Long id, double threshold, double exploration) {
        return new ControlPlaneSnapshot(
                id,
                EFFECTIVE_AT,
                null,
                threshold,
                exploration,
                Map.of("hot_take", 4.0 / 3.0, "thread", 2.0 / 3.0),
                Map.of("hot_take", Map.of("v2", 1.2, "v1", 0.8)),
                "policy_updater",
                "reward_mean=6.00");
    }

    @Test
    void active_returnsActivePolicy() throws Exception {
        when(controlPlaneService.getActiveState()).thenReturn(snapshot(3L, 0.65, 0.15));

        mockMvc.perform(get("/api/policy/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.acceptanceThreshold").value(0.65))
                .andExpect(jsonPath("$.explorationRate").value(0.15))
                .andExpect(jsonPath("$.promptVersionWeights.hot_take.v2").value(1.2))
                .andExpect(jsonPath("$.expiresAt").doesNotExist());
    }

    @Test
    void history_usesRequestedLimit() throws Exception {
        when(controlPlaneService.history(2)).thenReturn(List.of(snapshot(3L, 0.65, 0.15), snapshot(2L, 0.6, 0.1)));

        mockMvc.perform(get("/api/policy/history").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(3))
                .andExpect(jsonPath("$[1].id").value(2));
    }

    @Test
    void update_dryRunReportsWouldBeState() throws Exception {
        PolicyUpdateResult result = new PolicyUpdateResult(
                false,
                true,
                snapshot(2L, 0.6, 0.1),
                snapshot(null, 0.65, 0.15),
                new PolicyUpdateResult.Stats(4, 6.0, 5.28,
                        Map.of("hot_take", 8.0, "thread", 4.0),
                        Map.of("hot_take", 2, "thread", 2),
                        0.05, 0.05, "reward_mean=6.00"));
        when(policyUpdaterService.runPolicyUpdate(true)).thenReturn(result);

        mockMvc.perform(post("/api/policy/update").param("dryRun", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(false))
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.before.acceptanceThreshold").value(0.6))
                .andExpect(jsonPath("$.after.acceptanceThreshold").value(0.65))
                .andExpect(jsonPath("$.stats.decisionCount").value(4))
                .andExpect(jsonPath("$.stats.rewardVariance").value(5.28));
    }

    @Test
    void update_failureReturnsServerError() throws Exception {
        when(policyUpdaterService.runPolicyUpdate(false))
                .thenThrow(new PolicyUpdateException("Failed to write control-plane state"));

        mockMvc.perform(post("/api/policy/update"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("policy_update_failed"))
                .andExpect(jsonPath("$.message").value("Failed to write control-plane state"));
    }
}
