package com.tradingagent.strategy.impl;

import com.tradingagent.domain.enums.ExecutionMode;
import com.tradingagent.domain.model.Opportunity;
import com.tradingagent.domain.model.TradeSignal;
import com.tradingagent.strategy.StrategyProperties;
import com.tradingagent.strategy.base.BaseStrategy;
import com.tradingagent.strategy.base.CancellationToken;
import com.tradingagent.strategy.base.StrategyContext;
import com.tradingagent.strategy.feed.SignalChannel;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Continuous strategy that copies trades observed by an external listener.
 *
 * <p>Signals name a ticker selector rather than a market, since the copied trader's market window
 * may already have rolled by the time the order is placed. Every poll drains the retry queue
 * before taking new signals.
 */
public class SignalFollowStrategy extends BaseStrategy {

    private static final Logger log = LoggerFactory.getLogger(SignalFollowStrategy.class);

    public static final String NAME = "signal-follow";

    private final SignalChannel signalChannel;
    private final StrategyProperties.SignalFollow settings;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public SignalFollowStrategy(
            StrategyContext context, SignalChannel signalChannel, StrategyProperties.SignalFollow settings) {
        super(NAME, settings.isDryRun(), context);
        this.signalChannel = signalChannel;
        this.settings = settings;
    }

    @Override
    public ExecutionMode getExecutionMode() {
        return ExecutionMode.CONTINUOUS;
    }

    @Override
    public Duration getScanInterval() {
        return settings.getPollInterval();
    }

    @Override
    public void runContinuously(CancellationToken token) {
        cancelled.set(false);
        log.info("[{}] Listening for signals ({})", name, universe);
        while (!token.isCancelled() && !cancelled.get()) {
            context.getTradeSubmitter().drainRetryQueue();
            List<TradeSignal> signals;
            try {
                signals = signalChannel.await(settings.getPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!signals.isEmpty() && !token.isCancelled()) {
                int executed = execute(toOpportunities(signals));
                log.info("[{}] Copied {}/{} signals", name, executed, signals.size());
            }
        }
        log.info("[{}] Signal loop stopped", name);
    }

    @Override
    public void cancel() {
        cancelled.set(true);
    }

    @Override
    protected List<Opportunity> findOpportunities() {
        return toOpportunities(signalChannel.drain());
    }

    @Override
    public int execute(List<Opportunity> opportunities) {
        int executed = 0;
        for (Opportunity opportunity : opportunities) {
            if (placeTrade(opportunity)) {
                executed++;
            }
        }
        return executed;
    }

    private List<Opportunity> toOpportunities(List<TradeSignal> signals) {
        return signals.stream()
                .filter(s -> s.getContracts() > 0)
                .map(s -> Opportunity.builder()
                        .tickerSelector(s.getTickerSelector())
                        .marketTitle(s.getMarketTitle())
                        .side(s.getSide())
                        .priceCents(s.getPriceCents())
                        .contracts(Math.min(s.getContracts(), settings.getMaxContracts()))
                        .source(s.getSource())
                        .build())
                .toList();
    }
}
