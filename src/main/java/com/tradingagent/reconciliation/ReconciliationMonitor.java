package com.tradingagent.reconciliation;

import com.tradingagent.domain.enums.MarketStatus;
import com.tradingagent.domain.enums.Recommendation;
import com.tradingagent.domain.enums.SettlementState;
import com.tradingagent.domain.enums.Side;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.HedgeRecommendation;
import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.PositionAnalysis;
import com.tradingagent.domain.model.PositionSummary;
import com.tradingagent.domain.model.ReconciliationResult;
import com.tradingagent.domain.model.SettlementRecord;
import com.tradingagent.event.ReconciliationEvent;
import com.tradingagent.exchange.ExchangeGateway;
import com.tradingagent.exchange.model.ExchangePosition;
import com.tradingagent.exchange.model.SettlementStatus;
import com.tradingagent.ledger.PositionLedger;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Keeps the ledger honest against the exchange and grades open positions.
 *
 * <p>Sync: positions open in the ledger but no longer held on the exchange are checked for
 * settlement. Only an explicit settled status with a settlement price closes a position. A
 * finalized market stays open until its result is published; anything ambiguous is reported as
 * UNKNOWN and left for manual review. If the exchange position list cannot be fetched, nothing
 * is touched.
 *
 * <p>Simulated positions are never held on the exchange, so every open simulated row is checked
 * for settlement on each sync.
 *
 * <p>Settlement P&L per contract is the payout of the held side minus its entry price:
 * YES pays the settlement price, NO pays {@code 100 - settlement price}.
 */
@Service
public class ReconciliationMonitor {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationMonitor.class);

    private final ExchangeGateway exchangeGateway;
    private final PositionLedger positionLedger;
    private final MonitorConfig monitorConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReconciliationMonitor(
            ExchangeGateway exchangeGateway,
            PositionLedger positionLedger,
            MonitorConfig monitorConfig,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.positionLedger = positionLedger;
        this.monitorConfig = monitorConfig;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    // ========================
    // EXCHANGE SYNC
    // ========================

    /** Syncs every strategy in both universes. */
    public List<ReconciliationResult> reconcileAll() {
        List<ReconciliationResult> results = new ArrayList<>();
        for (Universe universe : Universe.values()) {
            results.add(syncWithExchange(null, universe));
        }
        return results;
    }

    /**
     * Checks open positions of {@code strategy} (null = all) against the exchange and closes
     * those whose market has settled.
     */
    public ReconciliationResult syncWithExchange(String strategy, Universe universe) {
        Instant started = clock.instant();
        List<Position> open = positionLedger.getOpenPositions(strategy, universe);
        ReconciliationResult result = ReconciliationResult.builder()
                .timestamp(LocalDateTime.now(clock))
                .strategy(strategy)
                .universe(universe)
                .localOpenCount(open.size())
                .build();

        Set<String> held;
        if (universe.isSimulated()) {
            held = Set.of();
        } else {
            try {
                held = exchangeGateway.getPositions().stream()
                        .filter(p -> p.getPosition() != 0)
                        .map(ExchangePosition::getTicker)
                        .collect(Collectors.toSet());
            } catch (RuntimeException e) {
                log.error("Reconciliation aborted for {}/{}: exchange positions unavailable: {}",
                        strategyLabel(strategy), universe, e.getMessage(), e);
                result.setAborted(true);
                result.setAbortReason(e.getMessage());
                return finish(result, started);
            }
        }
        result.setExchangeCount(held.size());

        for (Position position : open) {
            if (held.contains(position.getTicker())) {
                continue;
            }
            result.getRecords().add(resolveMissing(position, universe));
        }

        if (result.hasUnknown()) {
            log.warn("Reconciliation {}/{}: {} settled, {} finalized, {} UNKNOWN (manual review)",
                    strategyLabel(strategy), universe, result.count(SettlementState.SETTLED),
                    result.count(SettlementState.FINALIZED), result.count(SettlementState.UNKNOWN));
        } else {
            log.info("Reconciliation {}/{}: {} open, {} settled, {} finalized",
                    strategyLabel(strategy), universe, open.size(), result.count(SettlementState.SETTLED),
                    result.count(SettlementState.FINALIZED));
        }
        return finish(result, started);
    }

    /** P&L in dollars of settling {@code position} at a YES settlement price. */
    public static BigDecimal settlementPnl(Position position, int settlementPrice) {
        int payout = payoutFor(position.getSide(), settlementPrice);
        return BigDecimal.valueOf((long) (payout - position.getEntryPrice()) * position.getContracts())
                .movePointLeft(2);
    }

    private SettlementRecord resolveMissing(Position position, Universe universe) {
        String ticker = position.getTicker();
        SettlementStatus status;
        try {
            status = exchangeGateway.getSettlementStatus(ticker);
        } catch (RuntimeException e) {
            log.warn("Settlement status for {} unavailable, marking UNKNOWN: {}", ticker, e.getMessage());
            return unknown(ticker, "Status query failed: " + e.getMessage());
        }
        if (status == null) {
            return unknown(ticker, "No settlement status returned");
        }

        if (status.getStatus() == MarketStatus.SETTLED && status.getSettlementPrice() != null) {
            int settlementPrice = status.getSettlementPrice();
            BigDecimal pnl = settlementPnl(position, settlementPrice);
            int exitPrice = payoutFor(position.getSide(), settlementPrice);
            positionLedger.closePosition(ticker, exitPrice, pnl, universe);
            log.info("Settled {} {} x{} @ {}c -> {}c, P&L ${}",
                    ticker, position.getSide(), position.getContracts(), position.getEntryPrice(),
                    settlementPrice, pnl);
            return SettlementRecord.builder()
                    .ticker(ticker)
                    .state(SettlementState.SETTLED)
                    .settlementPrice(settlementPrice)
                    .pnl(pnl)
                    .build();
        }

        if (status.getStatus() == MarketStatus.FINALIZED || status.getStatus() == MarketStatus.CLOSED) {
            log.info("{} finalized, awaiting settlement", ticker);
            return SettlementRecord.builder()
                    .ticker(ticker)
                    .state(SettlementState.FINALIZED)
                    .detail("Awaiting settlement result")
                    .build();
        }

        if (status.getStatus() == MarketStatus.OPEN && universe.isSimulated()) {
            return SettlementRecord.builder().ticker(ticker).state(SettlementState.OPEN).build();
        }

        log.warn("{} missing from exchange with status {} and price {}, marking UNKNOWN",
                ticker, status.getStatus(), status.getSettlementPrice());
        return unknown(ticker, "Status " + status.getStatus() + " without settlement price");
    }

    private ReconciliationResult finish(ReconciliationResult result, Instant started) {
        result.setDuration(Duration.between(started, clock.instant()));
        eventPublisher.publishEvent(new ReconciliationEvent(this, result));
        return result;
    }

    private static SettlementRecord unknown(String ticker, String detail) {
        return SettlementRecord.builder()
                .ticker(ticker)
                .state(SettlementState.UNKNOWN)
                .detail(detail)
                .build();
    }

    private static int payoutFor(Side side, int settlementPrice) {
        return side == Side.YES ? settlementPrice : 100 - settlementPrice;
    }

    // ========================
    // POSITION GRADING
    // ========================

    /**
     * Grades one open position against current market data.
     *
     * <p>Rules, in order: SETTLED if the market reports settlement; EXIT below the stop loss or
     * above the take profit; HEDGE when edge is under the edge threshold and the position has
     * moved more than {@code hedgeMovePct} either way; HOLD when edge is above
     * {@code holdEdge}; otherwise WATCH.
     */
    public PositionAnalysis analyzePosition(Position position, MarketDataProvider marketData) {
        Optional<MarketSnapshot> snapshot = marketData.snapshot(position.getTicker());
        if (snapshot.isEmpty()) {
            return PositionAnalysis.builder()
                    .position(position)
                    .currentPrice(position.getEntryPrice())
                    .recommendation(Recommendation.WATCH)
                    .reason("No market data")
                    .build();
        }

        MarketSnapshot market = snapshot.get();
        double pnlPct = pnlPct(position, market.getCurrentPrice());
        double edge = market.getEdge();
        PositionAnalysis.PositionAnalysisBuilder analysis = PositionAnalysis.builder()
                .position(position)
                .currentPrice(market.getCurrentPrice())
                .pnlPct(pnlPct)
                .edge(edge);

        if (market.isSettled()) {
            return analysis.recommendation(Recommendation.SETTLED).reason("Market settled").build();
        }
        if (pnlPct < monitorConfig.getStopLossPct()) {
            return analysis.recommendation(Recommendation.EXIT)
                    .reason(String.format("Stop loss: %.1f%%", pnlPct * 100))
                    .build();
        }
        if (pnlPct > monitorConfig.getTakeProfitPct()) {
            return analysis.recommendation(Recommendation.EXIT)
                    .reason(String.format("Take profit: %.1f%%", pnlPct * 100))
                    .build();
        }
        if (edge < monitorConfig.getEdgeThreshold() && Math.abs(pnlPct) > monitorConfig.getHedgeMovePct()) {
            return analysis.recommendation(Recommendation.HEDGE)
                    .reason(String.format("Edge %.3f below threshold with %.1f%% move", edge, pnlPct * 100))
                    .build();
        }
        if (edge > monitorConfig.getHoldEdge()) {
            return analysis.recommendation(Recommendation.HOLD).reason("Edge intact").build();
        }
        return analysis.recommendation(Recommendation.WATCH).reason("Edge thinning").build();
    }

    public List<PositionAnalysis> checkAllPositions(String strategy, Universe universe, MarketDataProvider marketData) {
        List<PositionAnalysis> analyses = new ArrayList<>();
        for (Position position : positionLedger.getOpenPositions(strategy, universe)) {
            try {
                PositionAnalysis analysis = analyzePosition(position, marketData);
                analyses.add(analysis);
                if (analysis.getRecommendation() == Recommendation.EXIT
                        || analysis.getRecommendation() == Recommendation.HEDGE) {
                    log.info("{} {}: {} ({})", strategyLabel(strategy), position.getTicker(),
                            analysis.getRecommendation(), analysis.getReason());
                }
            } catch (RuntimeException e) {
                log.error("Failed to analyze {} for {}: {}", position.getTicker(), strategyLabel(strategy),
                        e.getMessage(), e);
            }
        }
        return analyses;
    }

    /** One opposite-side hedge per HEDGE recommendation. */
    public List<HedgeRecommendation> generateHedgeRecommendations(List<PositionAnalysis> analyses) {
        return analyses.stream()
                .filter(a -> a.getRecommendation() == Recommendation.HEDGE)
                .map(a -> HedgeRecommendation.builder()
                        .ticker(a.getPosition().getTicker())
                        .originalSide(a.getPosition().getSide())
                        .hedgeSide(a.getPosition().getSide().opposite())
                        .hedgeSize(calculateHedgeSize(a.getPnlPct()))
                        .pnlPct(a.getPnlPct())
                        .reason(a.getReason())
                        .build())
                .toList();
    }

    /** Full base size above +30%, half (at least 1) above +10%, otherwise 1. */
    public int calculateHedgeSize(double pnlPct) {
        int base = monitorConfig.getBaseHedgeSize();
        if (pnlPct > 0.30) {
            return base;
        }
        if (pnlPct > 0.10) {
            return Math.max(1, base / 2);
        }
        return 1;
    }

    public PositionSummary getPositionSummary(String strategy, Universe universe) {
        List<Position> open = positionLedger.getOpenPositions(strategy, universe);
        return PositionSummary.builder()
                .strategy(strategy)
                .universe(universe)
                .openPositions(open.size())
                .openContracts(open.stream().mapToInt(Position::getContracts).sum())
                .openNotional(open.stream().map(Position::getNotional).reduce(BigDecimal.ZERO, BigDecimal::add))
                .positions(open)
                .performance(positionLedger.getPerformance(strategy, universe))
                .build();
    }

    /**
     * Fractional move of the held side. Both entry and current price are quoted for the side held,
     * so the same formula applies to YES and NO.
     */
    static double pnlPct(Position position, int currentPrice) {
        double entry = position.getEntryPrice();
        return (currentPrice - entry) / entry;
    }

    private static String strategyLabel(String strategy) {
        return strategy != null ? strategy : "all";
    }
}
