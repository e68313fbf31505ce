package com.tradeguard.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradeguard.api.controller.RiskController;
import com.tradeguard.config.ApiResponseAdvice;
import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.TripReason;
import com.tradeguard.exception.GlobalExceptionHandler;
import com.tradeguard.exception.UnauthorizedException;
import com.tradeguard.risk.KillSwitchResult;
import com.tradeguard.risk.KillSwitchService;
import com.tradeguard.risk.OperatorConfirmation;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskLimits;
import com.tradeguard.risk.RiskStateSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class RiskControllerTest {

    private static final String KILL_BODY = "{\"nonce\":\"n-1\",\"detail\":\"desk halt\",\"confirmations\":["
            + "{\"operatorId\":\"alice\",\"token\":\"aa\"},{\"operatorId\":\"bob\",\"token\":\"bb\"}]}";

    private MockMvc mockMvc;

    @Mock
    private RiskEngine riskEngine;

    @Mock
    private KillSwitchService killSwitchService;

    @InjectMocks
    private RiskController riskController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(riskController)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/risk/state returns kill switch, P&L and limits")
    void getStateReturnsSnapshot() throws Exception {
        when(riskEngine.state())
                .thenReturn(RiskStateSnapshot.builder()
                        .killSwitchState(KillSwitchState.TRIPPED)
                        .tripReason(TripReason.DRAWDOWN_BREACH)
                        .tripDetail("daily loss 250")
                        .tradingDay(LocalDate.of(2026, 3, 2))
                        .dailyRealizedPnl(new BigDecimal("-200"))
                        .unrealizedPnl(new BigDecimal("-50"))
                        .consecutiveAnomalies(0)
                        .exposureBySymbol(Map.of("BTCUSDT", new BigDecimal("1000")))
                        .grossExposure(new BigDecimal("1000"))
                        .build());
        when(riskEngine.limits())
                .thenReturn(RiskLimits.builder()
                        .maxTradeNotional(new BigDecimal("1000"))
                        .dailyLossLimit(new BigDecimal("200"))
                        .build());

        mockMvc.perform(get("/api/risk/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.killSwitchState").value("TRIPPED"))
                .andExpect(jsonPath("$.data.killSwitchActive").value(true))
                .andExpect(jsonPath("$.data.tripReason").value("DRAWDOWN_BREACH"))
                .andExpect(jsonPath("$.data.dailyPnl").value(-250))
                .andExpect(jsonPath("$.data.exposureBySymbol.BTCUSDT").value(1000))
                .andExpect(jsonPath("$.data.limits.dailyLossLimit").value(200));
    }

    @Test
    @DisplayName("POST /api/risk/kill passes nonce, confirmations and detail to the kill switch")
    @SuppressWarnings("unchecked")
    void killTripsWithConfirmations() throws Exception {
        when(killSwitchService.manualTrip(eq("n-1"), anyList(), eq("desk halt")))
                .thenReturn(KillSwitchResult.builder()
                        .changed(true)
                        .state(KillSwitchState.TRIPPED)
                        .reason(TripReason.MANUAL)
                        .detail("desk halt (confirmed by alice,bob)")
                        .at(Instant.parse("2026-03-02T10:00:00Z"))
                        .operators(List.of("alice", "bob"))
                        .build());

        mockMvc.perform(post("/api/risk/kill").contentType(MediaType.APPLICATION_JSON).content(KILL_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.changed").value(true))
                .andExpect(jsonPath("$.data.state").value("TRIPPED"))
                .andExpect(jsonPath("$.data.reason").value("MANUAL"))
                .andExpect(jsonPath("$.data.operators[1]").value("bob"));

        ArgumentCaptor<List<OperatorConfirmation>> captor = ArgumentCaptor.forClass(List.class);
        verify(killSwitchService).manualTrip(eq("n-1"), captor.capture(), eq("desk halt"));
        assertThat(captor.getValue()).extracting(OperatorConfirmation::getOperatorId).containsExactly("alice", "bob");
    }

    @Test
    @DisplayName("POST /api/risk/reset re-arms through the kill switch service")
    void resetRearms() throws Exception {
        when(killSwitchService.reset(eq("n-1"), anyList(), eq("desk halt")))
                .thenReturn(KillSwitchResult.builder()
                        .changed(true)
                        .state(KillSwitchState.ARMED)
                        .build());

        mockMvc.perform(post("/api/risk/reset").contentType(MediaType.APPLICATION_JSON).content(KILL_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("ARMED"));
    }

    @Test
    @DisplayName("POST /api/risk/kill returns 400 when the nonce is missing")
    void killRejectsMissingNonce() throws Exception {
        mockMvc.perform(post("/api/risk/kill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"confirmations\":[{\"operatorId\":\"alice\",\"token\":\"aa\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.nonce").exists());

        verifyNoInteractions(killSwitchService);
    }

    @Test
    @DisplayName("POST /api/risk/reset returns 401 when confirmations are refused")
    void resetReturnsUnauthorized() throws Exception {
        when(killSwitchService.reset(any(), anyList(), any()))
                .thenThrow(new UnauthorizedException("Two distinct operator confirmations required, got 1"));

        mockMvc.perform(post("/api/risk/reset").contentType(MediaType.APPLICATION_JSON).content(KILL_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
    }
}
