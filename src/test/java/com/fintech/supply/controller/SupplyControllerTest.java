package com.fintech.supply.controller;

import com.fintech.supply.dto.ReconciliationResult;
import com.fintech.supply.service.SupplyReconciler;
import com.fintech.supply.service.SupplyReconciliationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.fintech.supply.SupplyFixtures.layerOne;
import static com.fintech.supply.SupplyFixtures.layerTwo;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SupplyController.class)
@Import(SupplyControllerTest.FixedClockConfig.class)
class SupplyControllerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SupplyReconciliationService reconciliationService;

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    private static ReconciliationResult success() {
        return ReconciliationResult.builder()
                .success(true)
                .reconciledSupply(new SupplyReconciler(Clock.fixed(NOW, ZoneOffset.UTC))
                        .reconcile(layerOne(), layerTwo()))
                .build();
    }

    private static ReconciliationResult failure(boolean circuitOpen, String... errors) {
        return ReconciliationResult.builder()
                .success(false)
                .circuitOpen(circuitOpen)
                .errors(new ArrayList<>(List.of(errors)))
                .build();
    }

    @Nested
    @DisplayName("Supply Endpoint Tests")
    class SupplyEndpointTests {

        @Test
        @DisplayName("Should serve total supply as plain text")
        void shouldServeTokenSupply() throws Exception {
            // Given
            when(reconciliationService.reconcileLatest()).thenReturn(success());

            // When / Then
            mockMvc.perform(get("/token-supply"))
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                    .andExpect(content().string("10114095110.8"));
        }

        @Test
        @DisplayName("Should serve circulating supply at a timestamp")
        void shouldServeCirculatingSupplyAtTimestamp() throws Exception {
            // Given
            when(reconciliationService.reconcileAtTimestamp(1_717_243_200L)).thenReturn(success());

            // When / Then
            mockMvc.perform(get("/circulating-supply").param("timestamp", "1717243200"))
                    .andExpect(status().isOk())
                    .andExpect(content().string("8214095110.8"));
            verify(reconciliationService, never()).reconcileLatest();
        }

        @Test
        @DisplayName("Should serve the full reconciled state with breakdowns")
        void shouldServeGlobalState() throws Exception {
            // Given
            when(reconciliationService.reconcileLatest()).thenReturn(success());

            // When / Then
            mockMvc.perform(get("/global-state"))
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                    .andExpect(jsonPath("$.totalSupply").value(10114095110.8))
                    .andExpect(jsonPath("$.lockedSupply").value(2000000000))
                    .andExpect(jsonPath("$.l1Breakdown.totalSupply").value(layerOne().getTotalSupply()))
                    .andExpect(jsonPath("$.l2Breakdown.netSupply").value(layerTwo().getNetSupply()))
                    .andExpect(jsonPath("$.reconciliationTimestamp").value("2024-06-01T12:00:00Z"));
        }
    }

    @Nested
    @DisplayName("Error Handling Tests")
    class ErrorHandlingTests {

        @Test
        @DisplayName("Should answer 503 with the collected errors when reconciliation fails")
        void shouldAnswerServiceUnavailable() throws Exception {
            // Given
            when(reconciliationService.reconcileLatest()).thenReturn(failure(true,
                    "L1 fetch failed: Circuit breaker open for L1_LATEST_GLOBAL_STATE. Too many recent failures."));

            // When / Then
            mockMvc.perform(get("/token-supply"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value("Failed to fetch deterministic supply data"))
                    .andExpect(jsonPath("$.details[0]").value(
                            "L1 fetch failed: Circuit breaker open for L1_LATEST_GLOBAL_STATE. Too many recent failures."))
                    .andExpect(jsonPath("$.circuitOpen").value(true))
                    .andExpect(jsonPath("$.timestamp").value("2024-06-01T12:00:00Z"));
        }

        @Test
        @DisplayName("Should answer 503 for the global state too")
        void shouldAnswerServiceUnavailableForGlobalState() throws Exception {
            // Given
            when(reconciliationService.reconcileLatest())
                    .thenReturn(failure(false, "L1 fetch failed: down", "L2 fetch failed: down"));

            // When / Then
            mockMvc.perform(get("/global-state"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.details.length()").value(2))
                    .andExpect(jsonPath("$.circuitOpen").value(false));
        }

        @Test
        @DisplayName("Should reject a non-numeric timestamp")
        void shouldRejectNonNumericTimestamp() throws Exception {
            mockMvc.perform(get("/token-supply").param("timestamp", "yesterday"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid value for parameter 'timestamp'"));
            verify(reconciliationService, never()).reconcileAtTimestamp(anyLong());
        }

        @Test
        @DisplayName("Should reject a non-positive timestamp")
        void shouldRejectNonPositiveTimestamp() throws Exception {
            mockMvc.perform(get("/circulating-supply").param("timestamp", "-1"))
                    .andExpect(status().isBadRequest());
            verify(reconciliationService, never()).reconcileAtTimestamp(anyLong());
        }
    }
}
