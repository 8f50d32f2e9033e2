package com.tradingagent.strategy.base;

import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.Opportunity;
import com.tradingagent.domain.model.PerformanceSummary;
import com.tradingagent.domain.model.QueuedTrade;
import com.tradingagent.domain.model.RiskProfile;
import com.tradingagent.oms.SubmissionResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared trade path for strategies.
 *
 * <p>{@link #scan()} drains the retry queue before looking for new opportunities. Each
 * opportunity then goes through {@link #placeTrade(Opportunity)}:
 * <ol>
 *   <li>skip tickers already open in this universe</li>
 *   <li>circuit breaker ({@code canTrade})</li>
 *   <li>minimum EV of the current risk profile</li>
 *   <li>fractional-Kelly size, capped at this strategy's allocation of the bankroll</li>
 *   <li>exposure gate, which may shrink or zero the size</li>
 *   <li>whole contracts at the limit price, then submission</li>
 * </ol>
 * Signals that carry a fixed contract count skip the Kelly step but not the gates.
 */
public abstract class BaseStrategy implements Strategy {

    private static final Logger log = LoggerFactory.getLogger(BaseStrategy.class);

    protected final String name;
    protected final Universe universe;
    protected final StrategyContext context;

    private final AtomicInteger tradesPlaced = new AtomicInteger();
    private final AtomicInteger tradesQueued = new AtomicInteger();

    protected BaseStrategy(String name, boolean dryRun, StrategyContext context) {
        this.name = name;
        this.universe = Universe.of(dryRun);
        this.context = context;
    }

    /** Opportunities visible right now. Called after the retry queue has been drained. */
    protected abstract List<Opportunity> findOpportunities();

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Universe getUniverse() {
        return universe;
    }

    @Override
    public final List<Opportunity> scan() {
        context.getTradeSubmitter().drainRetryQueue();
        return findOpportunities();
    }

    @Override
    public PerformanceSummary getPerformance() {
        return context.getPositionLedger().getPerformance(name, universe);
    }

    public int getTradesPlaced() {
        return tradesPlaced.get();
    }

    public int getTradesQueued() {
        return tradesQueued.get();
    }

    /**
     * Sizes and submits one opportunity.
     *
     * @return true when a position was opened or the order was queued for retry
     */
    protected boolean placeTrade(Opportunity opportunity) {
        if (opportunity.getPriceCents() < 1 || opportunity.getPriceCents() > 99) {
            log.debug("[{}] Ignoring {} at invalid price {}c", name, label(opportunity), opportunity.getPriceCents());
            return false;
        }
        if (opportunity.getTicker() != null
                && context.getPositionLedger().hasOpenPosition(opportunity.getTicker(), universe)) {
            log.debug("[{}] Already holding {}", name, opportunity.getTicker());
            return false;
        }

        BigDecimal bankroll = context.getBankrollService().currentBankroll(universe);
        if (!context.getRiskSizer().canTrade(bankroll, universe)) {
            log.info("[{}] Trading halted by circuit breaker, skipping {}", name, label(opportunity));
            return false;
        }

        BigDecimal dollars;
        if (opportunity.getContracts() > 0) {
            dollars = notional(opportunity.getContracts(), opportunity.getPriceCents());
        } else {
            double winRate = context.getPositionLedger().getPerformance(null, universe).getWinRate();
            RiskProfile profile = context.getRiskSizer().getRiskProfile(bankroll, winRate);
            double odds = opportunity.getOdds();
            double ev = context.getRiskSizer().calculateEv(opportunity.getWinProbability(), odds);
            if (ev < profile.getMinEvThreshold()) {
                log.debug("[{}] {} EV {} below {} threshold {}",
                        name, label(opportunity), ev, profile.getLevel().getLabel(), profile.getMinEvThreshold());
                return false;
            }
            dollars = context.getRiskSizer().calculatePositionSize(bankroll, winRate, ev, odds);
        }

        BigDecimal allocationCap = bankroll.multiply(BigDecimal.valueOf(context.getAllocationBook().get(name)));
        dollars = dollars.min(allocationCap);
        if (dollars.signum() <= 0) {
            return false;
        }
        return submit(opportunity, dollars, bankroll);
    }

    private boolean submit(Opportunity opportunity, BigDecimal dollars, BigDecimal bankroll) {
        BigDecimal granted = context.getExposureTracker().reserve(universe, dollars, bankroll);
        int contracts = granted.movePointRight(2)
                .divide(BigDecimal.valueOf(opportunity.getPriceCents()), 0, RoundingMode.DOWN)
                .intValue();
        if (opportunity.getContracts() > 0) {
            contracts = Math.min(contracts, opportunity.getContracts());
        }
        BigDecimal used = notional(contracts, opportunity.getPriceCents());
        context.getExposureTracker().release(universe, granted.subtract(used));
        if (contracts <= 0) {
            log.debug("[{}] No contracts affordable for {} within ${}", name, label(opportunity), granted);
            return false;
        }

        QueuedTrade trade = QueuedTrade.builder()
                .source(opportunity.getSource() != null ? opportunity.getSource() : name)
                .tickerSelector(opportunity.getTickerSelector())
                .ticker(opportunity.getTicker())
                .side(opportunity.getSide())
                .priceCents(opportunity.getPriceCents())
                .contracts(contracts)
                .strategy(name)
                .universe(universe)
                .marketTitle(opportunity.getMarketTitle())
                .expectedSettlement(opportunity.getExpectedSettlement())
                .reservedNotional(used)
                .build();

        SubmissionResult result = context.getTradeSubmitter().submit(trade);
        switch (result.getStatus()) {
            case OPENED -> {
                tradesPlaced.incrementAndGet();
                return true;
            }
            case QUEUED -> {
                tradesQueued.incrementAndGet();
                return true;
            }
            default -> {
                log.info("[{}] {} not opened: {} ({})", name, label(opportunity), result.getStatus(), result.getMessage());
                return false;
            }
        }
    }

    private static BigDecimal notional(int contracts, int priceCents) {
        return BigDecimal.valueOf((long) contracts * priceCents).movePointLeft(2);
    }

    private static String label(Opportunity opportunity) {
        return opportunity.getTicker() != null ? opportunity.getTicker() : opportunity.getTickerSelector();
    }
}
