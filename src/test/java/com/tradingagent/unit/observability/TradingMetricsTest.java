package com.tradingagent.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.tradingagent.domain.enums.SettlementState;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.QueuedTrade;
import com.tradingagent.domain.model.ReconciliationResult;
import com.tradingagent.domain.model.SettlementRecord;
import com.tradingagent.event.PositionEvent;
import com.tradingagent.event.PositionEventType;
import com.tradingagent.event.ReconciliationEvent;
import com.tradingagent.event.RetryQueueEvent;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.observability.TradingMetrics;
import com.tradingagent.oms.RetryQueue;
import com.tradingagent.risk.ExposureTracker;
import com.tradingagent.risk.RiskSizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradingMetricsTest {

    private SimpleMeterRegistry registry;
    private RetryQueue retryQueue;
    private PositionLedger positionLedger;
    private ExposureTracker exposureTracker;
    private RiskSizer riskSizer;
    private TradingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        retryQueue = mock(RetryQueue.class);
        positionLedger = mock(PositionLedger.class);
        exposureTracker = mock(ExposureTracker.class);
        riskSizer = mock(RiskSizer.class);
        when(exposureTracker.getExposure(any())).thenReturn(BigDecimal.ZERO);
        when(riskSizer.getDailyLoss(any())).thenReturn(BigDecimal.ZERO);
        metrics = new TradingMetrics(registry, retryQueue, positionLedger, exposureTracker, riskSizer);
    }

    @Test
    @DisplayName("Position events increment the counter for their universe")
    void positionCounters() {
        Position position = Position.builder().ticker("T1").build();

        metrics.onPositionEvent(new PositionEvent(this, position, Universe.SIMULATED, PositionEventType.OPENED));
        metrics.onPositionEvent(new PositionEvent(this, position, Universe.SIMULATED, PositionEventType.CLOSED));
        metrics.onPositionEvent(new PositionEvent(this, position, Universe.REAL, PositionEventType.OPENED));

        assertThat(registry.get("agent.positions.opened").tag("universe", "simulated").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("agent.positions.closed").tag("universe", "simulated").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("agent.positions.opened").tag("universe", "real").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Retry outcomes are counted by outcome")
    void retryOutcomes() {
        QueuedTrade trade = QueuedTrade.builder().tickerSelector("KXBTC").build();

        metrics.onRetryQueueEvent(new RetryQueueEvent(this, trade, RetryQueueEvent.Outcome.EXPIRED));
        metrics.onRetryQueueEvent(new RetryQueueEvent(this, trade, RetryQueueEvent.Outcome.EXPIRED));

        assertThat(registry.get("agent.retry.outcomes").tag("outcome", "expired").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Unknown settlements raise the manual-review counter")
    void unknownSettlements() {
        ReconciliationResult result = ReconciliationResult.builder()
                .records(List.of(
                        SettlementRecord.builder().ticker("A").state(SettlementState.UNKNOWN).build(),
                        SettlementRecord.builder().ticker("B").state(SettlementState.UNKNOWN).build()))
                .build();

        metrics.onReconciliationEvent(new ReconciliationEvent(this, result));

        assertThat(registry.get("agent.reconciliation.unknown").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Gauges read live state")
    void gauges() {
        when(retryQueue.size()).thenReturn(3);
        when(positionLedger.getOpenPositions(isNull(), any()))
                .thenReturn(List.of(Position.builder().ticker("T1").build()));
        when(exposureTracker.getExposure(Universe.REAL)).thenReturn(new BigDecimal("12.50"));

        assertThat(registry.get("agent.retry.queue.size").gauge().value()).isEqualTo(3.0);
        assertThat(registry.get("agent.positions.open").tag("universe", "real").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("agent.exposure").tag("universe", "real").gauge().value()).isEqualTo(12.5);
    }
}
