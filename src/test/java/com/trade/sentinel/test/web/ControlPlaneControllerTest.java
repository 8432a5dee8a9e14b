package com.trade.sentinel.test.web;

import com.trade.sentinel.common.Result;
import com.trade.sentinel.common.exception.CircuitOpenException;
import com.trade.sentinel.common.exception.GlobalExceptionHandler;
import com.trade.sentinel.service.ControlPlaneService;
import com.trade.sentinel.service.decision.DecisionStatus;
import com.trade.sentinel.service.decision.TradingMode;
import com.trade.sentinel.service.health.HealthStatus;
import com.trade.sentinel.web.ControlPlaneController;
import com.trade.sentinel.web.DecisionController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class ControlPlaneControllerTest {

    @Mock
    ControlPlaneService controlPlane;

    MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders
                .standaloneSetup(new ControlPlaneController(controlPlane), new DecisionController(controlPlane))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void modeChangeReturnsDecisionStatus() throws Exception {
        when(controlPlane.setMode(TradingMode.AUTO))
                .thenReturn(Result.ok(DecisionStatus.builder().mode(TradingMode.AUTO).build()));

        mvc.perform(put("/api/control/mode/AUTO"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("AUTO"));
    }

    @Test
    void unknownModeIsBadRequest() throws Exception {
        mvc.perform(put("/api/control/mode/YOLO"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ERR-REQ-004"));

        verifyNoInteractions(controlPlane);
    }

    @Test
    void unknownBreakerMapsToNotFound() throws Exception {
        when(controlPlane.resetBreakers("feed")).thenReturn(Result.fail("ERR-NOT-FOUND", "Unknown circuit breaker: feed"));

        mvc.perform(post("/api/control/breakers/reset").param("name", "feed"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ERR-NOT-FOUND"));
    }

    @Test
    void openCircuitSurfacesAs503WithRetryAfter() throws Exception {
        when(controlPlane.getBreakers()).thenThrow(new CircuitOpenException("venue", 12.3));

        mvc.perform(get("/api/control/breakers"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "13"));
    }

    @Test
    void historyLimitIsPassedThrough() throws Exception {
        when(controlPlane.history(5)).thenReturn(Result.ok(List.of()));

        mvc.perform(get("/api/decision/history").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));

        verify(controlPlane).history(5);
    }

    @Test
    void healthResetReturnsTheClearedStatus() throws Exception {
        when(controlPlane.resetHealth())
                .thenReturn(Result.ok(HealthStatus.builder().systemHealth(100.0).safeMode(false).build()));

        mvc.perform(post("/api/control/health/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.systemHealth").value(100.0))
                .andExpect(jsonPath("$.safeMode").value(false));
    }

    @Test
    void pauseIsAccepted() throws Exception {
        when(controlPlane.pause()).thenReturn(Result.ok(DecisionStatus.builder().paused(true).build()));

        mvc.perform(post("/api/control/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true));
    }
}
