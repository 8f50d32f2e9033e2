package com.tradingagent.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradingagent.domain.enums.MarketStatus;
import com.tradingagent.domain.enums.Recommendation;
import com.tradingagent.domain.enums.SettlementState;
import com.tradingagent.domain.enums.Side;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.HedgeRecommendation;
import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.PerformanceSummary;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.PositionAnalysis;
import com.tradingagent.domain.model.PositionSummary;
import com.tradingagent.domain.model.ReconciliationResult;
import com.tradingagent.event.ReconciliationEvent;
import com.tradingagent.exception.ExchangeException;
import com.tradingagent.exchange.ExchangeGateway;
import com.tradingagent.exchange.model.ExchangePosition;
import com.tradingagent.exchange.model.SettlementStatus;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.reconciliation.MarketDataProvider;
import com.tradingagent.reconciliation.MonitorConfig;
import com.tradingagent.reconciliation.ReconciliationMonitor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for ReconciliationMonitor: settlement handling during exchange sync and the
 * grading rules for open positions.
 */
class ReconciliationMonitorTest {

    private ExchangeGateway exchangeGateway;
    private PositionLedger positionLedger;
    private ApplicationEventPublisher eventPublisher;
    private ReconciliationMonitor monitor;

    @BeforeEach
    void setUp() {
        exchangeGateway = mock(ExchangeGateway.class);
        positionLedger = mock(PositionLedger.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        monitor = new ReconciliationMonitor(
                exchangeGateway, positionLedger, new MonitorConfig(), eventPublisher,
                Clock.fixed(Instant.parse("2025-03-14T10:00:00Z"), ZoneOffset.UTC));
    }

    private static Position position(String ticker, Side side, int contracts, int entryPrice) {
        return Position.builder()
                .ticker(ticker)
                .side(side)
                .contracts(contracts)
                .entryPrice(entryPrice)
                .strategy("edge-taking")
                .build();
    }

    private static SettlementStatus status(String ticker, MarketStatus status, Integer price) {
        return SettlementStatus.builder().ticker(ticker).status(status).settlementPrice(price).build();
    }

    @Nested
    @DisplayName("Settlement P&L")
    class SettlementPnl {

        @Test
        @DisplayName("YES 5 @ 30c settled at 100 earns $3.50")
        void yesWins() {
            assertThat(ReconciliationMonitor.settlementPnl(position("T", Side.YES, 5, 30), 100))
                    .isEqualByComparingTo("3.50");
        }

        @Test
        @DisplayName("YES 5 @ 30c settled at 0 loses $1.50")
        void yesLoses() {
            assertThat(ReconciliationMonitor.settlementPnl(position("T", Side.YES, 5, 30), 0))
                    .isEqualByComparingTo("-1.50");
        }

        @Test
        @DisplayName("NO 4 @ 62c settled at 0 earns $1.52")
        void noWins() {
            assertThat(ReconciliationMonitor.settlementPnl(position("T", Side.NO, 4, 62), 0))
                    .isEqualByComparingTo("1.52");
        }

        @Test
        @DisplayName("NO 4 @ 62c settled at 100 loses $2.48")
        void noLoses() {
            assertThat(ReconciliationMonitor.settlementPnl(position("T", Side.NO, 4, 62), 100))
                    .isEqualByComparingTo("-2.48");
        }
    }

    @Nested
    @DisplayName("Exchange sync")
    class Sync {

        @Test
        @DisplayName("Settled market closes the position with payout as exit price")
        void settledCloses() {
            when(positionLedger.getOpenPositions(null, Universe.REAL))
                    .thenReturn(List.of(position("T1", Side.YES, 5, 30)));
            when(exchangeGateway.getPositions()).thenReturn(List.of());
            when(exchangeGateway.getSettlementStatus("T1")).thenReturn(status("T1", MarketStatus.SETTLED, 100));

            ReconciliationResult result = monitor.syncWithExchange(null, Universe.REAL);

            verify(positionLedger).closePosition("T1", 100, new BigDecimal("3.50"), Universe.REAL);
            assertThat(result.count(SettlementState.SETTLED)).isEqualTo(1);
            assertThat(result.getRecords().get(0).getPnl()).isEqualByComparingTo("3.50");
        }

        @Test
        @DisplayName("NO position settled at 0 exits at 100 (its payout)")
        void noSettledExitPrice() {
            when(positionLedger.getOpenPositions(null, Universe.REAL))
                    .thenReturn(List.of(position("T1", Side.NO, 4, 62)));
            when(exchangeGateway.getPositions()).thenReturn(List.of());
            when(exchangeGateway.getSettlementStatus("T1")).thenReturn(status("T1", MarketStatus.SETTLED, 0));

            monitor.syncWithExchange(null, Universe.REAL);

            verify(positionLedger).closePosition("T1", 100, new BigDecimal("1.52"), Universe.REAL);
        }

        @Test
        @DisplayName("Positions still held on the exchange are not queried")
        void heldPositionsSkipped() {
            when(positionLedger.getOpenPositions(null, Universe.REAL))
                    .thenReturn(List.of(position("T1", Side.YES, 5, 30)));
            when(exchangeGateway.getPositions())
                    .thenReturn(List.of(ExchangePosition.builder().ticker("T1").position(5).build()));

            ReconciliationResult result = monitor.syncWithExchange(null, Universe.REAL);

            verify(exchangeGateway, never()).getSettlementStatus(any());
            assertThat(result.getRecords()).isEmpty();
            assertThat(result.getExchangeCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Finalized market without a result stays open")
        void finalizedStaysOpen() {
            when(positionLedger.getOpenPositions(null, Universe.REAL))
                    .thenReturn(List.of(position("T1", Side.YES, 5, 30)));
            when(exchangeGateway.getPositions()).thenReturn(List.of());
            when(exchangeGateway.getSettlementStatus("T1")).thenReturn(status("T1", MarketStatus.FINALIZED, null));

            ReconciliationResult result = monitor.syncWithExchange(null, Universe.REAL);

            verify(positionLedger, never()).closePosition(any(), anyInt(), any(), any());
            assertThat(result.count(SettlementState.FINALIZED)).isEqualTo(1);
        }

        @Test
        @DisplayName("Ambiguous status is UNKNOWN and never closes the position")
        void ambiguousIsUnknown() {
            when(positionLedger.getOpenPositions(null, Universe.REAL)).thenReturn(List.of(
                    position("T1", Side.YES, 5, 30),
                    position("T2", Side.YES, 5, 30),
                    position("T3", Side.YES, 5, 30)));
            when(exchangeGateway.getPositions()).thenReturn(List.of());
            when(exchangeGateway.getSettlementStatus("T1")).thenReturn(status("T1", MarketStatus.SETTLED, null));
            when(exchangeGateway.getSettlementStatus("T2")).thenReturn(status("T2", MarketStatus.OPEN, null));
            when(exchangeGateway.getSettlementStatus("T3")).thenThrow(new ExchangeException("timeout"));

            ReconciliationResult result = monitor.syncWithExchange(null, Universe.REAL);

            verify(positionLedger, never()).closePosition(any(), anyInt(), any(), any());
            assertThat(result.count(SettlementState.UNKNOWN)).isEqualTo(3);
            assertThat(result.hasUnknown()).isTrue();
        }

        @Test
        @DisplayName("Position fetch failure aborts the sync without touching the ledger")
        void positionFetchFailureAborts() {
            when(positionLedger.getOpenPositions(null, Universe.REAL))
                    .thenReturn(List.of(position("T1", Side.YES, 5, 30)));
            when(exchangeGateway.getPositions()).thenThrow(new ExchangeException("503"));

            ReconciliationResult result = monitor.syncWithExchange(null, Universe.REAL);

            assertThat(result.isAborted()).isTrue();
            assertThat(result.getAbortReason()).isEqualTo("503");
            verify(exchangeGateway, never()).getSettlementStatus(any());
            verify(positionLedger, never()).closePosition(any(), anyInt(), any(), any());

            ArgumentCaptor<ReconciliationEvent> captor = ArgumentCaptor.forClass(ReconciliationEvent.class);
            verify(eventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getResult().isAborted()).isTrue();
        }

        @Test
        @DisplayName("Simulated positions are checked for settlement without fetching exchange positions")
        void simulatedChecksEveryPosition() {
            when(positionLedger.getOpenPositions("edge-taking", Universe.SIMULATED))
                    .thenReturn(List.of(position("T1", Side.YES, 5, 30), position("T2", Side.NO, 2, 50)));
            when(exchangeGateway.getSettlementStatus("T1")).thenReturn(status("T1", MarketStatus.OPEN, null));
            when(exchangeGateway.getSettlementStatus("T2")).thenReturn(status("T2", MarketStatus.SETTLED, 100));

            ReconciliationResult result = monitor.syncWithExchange("edge-taking", Universe.SIMULATED);

            verify(exchangeGateway, never()).getPositions();
            verify(positionLedger).closePosition(eq("T2"), eq(0), any(), eq(Universe.SIMULATED));
            assertThat(result.count(SettlementState.OPEN)).isEqualTo(1);
            assertThat(result.count(SettlementState.SETTLED)).isEqualTo(1);
        }

        @Test
        @DisplayName("Reconcile-all syncs both universes")
        void reconcileAll() {
            when(exchangeGateway.getPositions()).thenReturn(List.of());

            List<ReconciliationResult> results = monitor.reconcileAll();

            assertThat(results).extracting(ReconciliationResult::getUniverse)
                    .containsExactly(Universe.REAL, Universe.SIMULATED);
        }
    }

    @Nested
    @DisplayName("Grading")
    class Grading {

        private MarketDataProvider market(int currentPrice, double edge, boolean settled) {
            return ticker -> Optional.of(MarketSnapshot.builder()
                    .ticker(ticker)
                    .currentPrice(currentPrice)
                    .edge(edge)
                    .settled(settled)
                    .build());
        }

        private Recommendation grade(int currentPrice, double edge) {
            return monitor.analyzePosition(position("T1", Side.YES, 5, 40), market(currentPrice, edge, false))
                    .getRecommendation();
        }

        @Test
        @DisplayName("No market data means WATCH")
        void noDataWatch() {
            PositionAnalysis analysis =
                    monitor.analyzePosition(position("T1", Side.YES, 5, 40), ticker -> Optional.empty());

            assertThat(analysis.getRecommendation()).isEqualTo(Recommendation.WATCH);
        }

        @Test
        @DisplayName("Settled market is SETTLED regardless of price")
        void settled() {
            assertThat(monitor.analyzePosition(position("T1", Side.YES, 5, 40), market(5, 0, true))
                    .getRecommendation()).isEqualTo(Recommendation.SETTLED);
        }

        @Test
        @DisplayName("Beyond stop loss or take profit means EXIT")
        void exitOnThresholds() {
            assertThat(grade(27, 0.30)).isEqualTo(Recommendation.EXIT); // -32.5%
            assertThat(grade(61, 0.30)).isEqualTo(Recommendation.EXIT); // +52.5%
        }

        @Test
        @DisplayName("Low edge with a move over 10% means HEDGE")
        void hedgeOnLowEdge() {
            assertThat(grade(46, 0.02)).isEqualTo(Recommendation.HEDGE); // +15%
            assertThat(grade(34, 0.02)).isEqualTo(Recommendation.HEDGE); // -15%
        }

        @Test
        @DisplayName("Strong edge means HOLD; anything else WATCH")
        void holdOrWatch() {
            assertThat(grade(42, 0.20)).isEqualTo(Recommendation.HOLD);
            assertThat(grade(42, 0.10)).isEqualTo(Recommendation.WATCH);
            assertThat(grade(42, 0.02)).isEqualTo(Recommendation.WATCH);
        }

        @Test
        @DisplayName("NO positions are graded on the NO price")
        void noSideUsesHeldPrice() {
            PositionAnalysis analysis =
                    monitor.analyzePosition(position("T1", Side.NO, 5, 60), market(30, 0.2, false));

            assertThat(analysis.getPnlPct()).isCloseTo(-0.5, within(1e-9));
            assertThat(analysis.getRecommendation()).isEqualTo(Recommendation.EXIT);
        }

        @Test
        @DisplayName("Hedge is the opposite side, sized by the move")
        void hedgeRecommendations() {
            when(positionLedger.getOpenPositions("edge-taking", Universe.REAL))
                    .thenReturn(List.of(position("T1", Side.YES, 5, 40), position("T2", Side.YES, 5, 40)));
            MarketDataProvider data = ticker -> Optional.of(MarketSnapshot.builder()
                    .ticker(ticker)
                    .currentPrice(ticker.equals("T1") ? 46 : 44)
                    .edge(0.01)
                    .build());

            List<PositionAnalysis> analyses = monitor.checkAllPositions("edge-taking", Universe.REAL, data);
            List<HedgeRecommendation> hedges = monitor.generateHedgeRecommendations(analyses);

            assertThat(analyses).hasSize(2);
            assertThat(hedges).singleElement().satisfies(h -> {
                assertThat(h.getTicker()).isEqualTo("T1");
                assertThat(h.getHedgeSide()).isEqualTo(Side.NO);
                assertThat(h.getHedgeSize()).isEqualTo(2);
            });
        }

        @Test
        @DisplayName("Hedge size tiers: base above 30%, half above 10%, else one")
        void hedgeSizeTiers() {
            assertThat(monitor.calculateHedgeSize(0.35)).isEqualTo(5);
            assertThat(monitor.calculateHedgeSize(0.15)).isEqualTo(2);
            assertThat(monitor.calculateHedgeSize(-0.20)).isEqualTo(1);
        }

        @Test
        @DisplayName("One failing analysis does not stop the others")
        void failingAnalysisSkipped() {
            when(positionLedger.getOpenPositions(null, Universe.REAL))
                    .thenReturn(List.of(position("BAD", Side.YES, 5, 40), position("T2", Side.YES, 5, 40)));
            MarketDataProvider data = ticker -> {
                if (ticker.equals("BAD")) {
                    throw new IllegalStateException("feed down");
                }
                return Optional.empty();
            };

            assertThat(monitor.checkAllPositions(null, Universe.REAL, data)).hasSize(1);
        }
    }

    @Test
    @DisplayName("Summary totals open contracts and notional")
    void summary() {
        when(positionLedger.getOpenPositions(null, Universe.REAL))
                .thenReturn(List.of(position("T1", Side.YES, 5, 30), position("T2", Side.NO, 10, 45)));
        when(positionLedger.getPerformance(null, Universe.REAL))
                .thenReturn(PerformanceSummary.empty());

        PositionSummary summary = monitor.getPositionSummary(null, Universe.REAL);

        assertThat(summary.getOpenPositions()).isEqualTo(2);
        assertThat(summary.getOpenContracts()).isEqualTo(15);
        assertThat(summary.getOpenNotional()).isEqualByComparingTo("6.00");
    }
}
