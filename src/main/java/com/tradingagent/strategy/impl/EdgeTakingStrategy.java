package com.tradingagent.strategy.impl;

import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.Opportunity;
import com.tradingagent.strategy.StrategyProperties;
import com.tradingagent.strategy.base.BaseStrategy;
import com.tradingagent.strategy.base.StrategyContext;
import com.tradingagent.strategy.feed.OpportunitySource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cyclic strategy that buys the side a model prices above the market.
 *
 * <p>Each cycle collects opportunities from every {@link OpportunitySource}, keeps those with
 * edge at or above {@code minEdge}, and trades the best few by expected value.
 */
public class EdgeTakingStrategy extends BaseStrategy {

    private static final Logger log = LoggerFactory.getLogger(EdgeTakingStrategy.class);

    public static final String NAME = "edge-taking";

    private final List<OpportunitySource> sources;
    private final StrategyProperties.EdgeTaking settings;

    public EdgeTakingStrategy(
            StrategyContext context, List<OpportunitySource> sources, StrategyProperties.EdgeTaking settings) {
        super(NAME, settings.isDryRun(), context);
        this.sources = List.copyOf(sources);
        this.settings = settings;
    }

    @Override
    public Duration getScanInterval() {
        return settings.getScanInterval();
    }

    @Override
    protected List<Opportunity> findOpportunities() {
        List<Opportunity> found = new ArrayList<>();
        for (OpportunitySource source : sources) {
            try {
                source.fetchOpportunities().stream()
                        .filter(EdgeTakingStrategy::hasTradablePrice)
                        .filter(o -> o.getEdge() >= settings.getMinEdge())
                        .filter(o -> o.getTicker() == null
                                || !context.getPositionLedger().hasOpenPosition(o.getTicker(), universe))
                        .forEach(found::add);
            } catch (RuntimeException e) {
                log.error("[{}] Source {} failed: {}", name, source.getName(), e.getMessage(), e);
            }
        }
        log.info("[{}] Scan found {} opportunities across {} sources", name, found.size(), sources.size());
        return found;
    }

    @Override
    public int execute(List<Opportunity> opportunities) {
        List<Opportunity> ranked = opportunities.stream()
                .filter(EdgeTakingStrategy::hasTradablePrice)
                .sorted(Comparator.comparingDouble(this::expectedValue).reversed())
                .limit(settings.getMaxTradesPerCycle())
                .toList();
        int executed = 0;
        for (Opportunity opportunity : ranked) {
            if (placeTrade(opportunity)) {
                executed++;
            }
        }
        return executed;
    }

    @Override
    public Optional<MarketSnapshot> marketSnapshot(String ticker) {
        for (OpportunitySource source : sources) {
            Optional<MarketSnapshot> snapshot = source.snapshot(ticker);
            if (snapshot.isPresent()) {
                return snapshot;
            }
        }
        return Optional.empty();
    }

    // 0c and 100c have no defined odds and would rank first on infinite EV
    private static boolean hasTradablePrice(Opportunity opportunity) {
        return opportunity.getPriceCents() >= 1 && opportunity.getPriceCents() <= 99;
    }

    private double expectedValue(Opportunity opportunity) {
        return context.getRiskSizer().calculateEv(opportunity.getWinProbability(), opportunity.getOdds());
    }
}
