package com.tradingagent.unit.api;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradingagent.api.controller.PositionController;
import com.tradingagent.config.ApiResponseAdvice;
import com.tradingagent.domain.enums.Side;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.PerformanceSummary;
import com.tradingagent.domain.model.Position;
import com.tradingagent.exception.ExchangeException;
import com.tradingagent.exception.GlobalExceptionHandler;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.reconciliation.ReconciliationMonitor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Standalone MockMvc tests for PositionController with the response envelope and error handler. */
@ExtendWith(MockitoExtension.class)
class PositionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private PositionLedger positionLedger;

    @Mock
    private ReconciliationMonitor reconciliationMonitor;

    @InjectMocks
    private PositionController positionController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(positionController)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler(Clock.systemUTC()))
                .build();
    }

    private static Position position(String ticker) {
        return Position.builder()
                .ticker(ticker)
                .side(Side.YES)
                .contracts(5)
                .entryPrice(30)
                .strategy("edge-taking")
                .build();
    }

    @Test
    @DisplayName("GET /api/positions lists open real positions in snake_case")
    void listsOpenPositions() throws Exception {
        when(positionLedger.getOpenPositions(isNull(), eq(Universe.REAL)))
                .thenReturn(List.of(position("KXHIGHNY-B70")));

        mockMvc.perform(get("/api/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data[0].ticker").value("KXHIGHNY-B70"))
                .andExpect(jsonPath("$.data[0].entry_price").value(30))
                .andExpect(jsonPath("$.data[0].status").value("OPEN"));
    }

    @Test
    @DisplayName("GET /api/positions honours universe and strategy filters")
    void filtersByUniverseAndStrategy() throws Exception {
        when(positionLedger.getOpenPositions("signal-follow", Universe.SIMULATED)).thenReturn(List.of());

        mockMvc.perform(get("/api/positions").param("universe", "SIMULATED").param("strategy", "signal-follow"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("GET /api/positions/{ticker} returns 404 for an unknown ticker")
    void unknownTicker() throws Exception {
        when(positionLedger.getPosition("NOPE", Universe.REAL)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/positions/NOPE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /api/positions/performance with a date returns that day's performance")
    void dailyPerformance() throws Exception {
        LocalDate day = LocalDate.of(2026, 10, 17);
        when(positionLedger.getDailyPerformance("edge-taking", Universe.REAL, day))
                .thenReturn(PerformanceSummary.builder().totalTrades(4).winningTrades(3).winRate(0.75)
                        .totalPnl(new BigDecimal("6.20")).build());

        mockMvc.perform(get("/api/positions/performance").param("strategy", "edge-taking").param("date", "2026-10-17"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalTrades").value(4))
                .andExpect(jsonPath("$.data.winRate").value(0.75));
    }

    @Test
    @DisplayName("An invalid universe is a bad request")
    void invalidUniverse() throws Exception {
        mockMvc.perform(get("/api/positions").param("universe", "PAPER"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("An exchange outage answers 502 with a retry hint")
    void exchangeOutage() throws Exception {
        when(reconciliationMonitor.getPositionSummary(null, Universe.REAL))
                .thenThrow(new ExchangeException("balance endpoint timed out"));

        mockMvc.perform(get("/api/positions/summary"))
                .andExpect(status().isBadGateway())
                .andExpect(header().string("Retry-After", "30"))
                .andExpect(jsonPath("$.error").value("EXCHANGE_UNAVAILABLE"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("POST /api/positions/simulated/reset clears the simulated ledger with a backup")
    void resetSimulated() throws Exception {
        when(positionLedger.clearSimulatedPositions(true)).thenReturn(7);

        mockMvc.perform(post("/api/positions/simulated/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.removed").value(7));

        verify(positionLedger).clearSimulatedPositions(true);
    }

    @Test
    @DisplayName("POST /api/positions/reconcile syncs both universes")
    void reconcile() throws Exception {
        when(reconciliationMonitor.reconcileAll()).thenReturn(List.of());

        mockMvc.perform(post("/api/positions/reconcile")).andExpect(status().isOk());

        verify(reconciliationMonitor).reconcileAll();
    }
}
