package com.tradingagent.strategy;

import com.tradingagent.core.engine.AllocationBook;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.oms.TradeSubmitter;
import com.tradingagent.risk.BankrollService;
import com.tradingagent.risk.ExposureTracker;
import com.tradingagent.risk.RiskSizer;
import com.tradingagent.strategy.base.StrategyContext;
import com.tradingagent.strategy.feed.OpportunitySource;
import com.tradingagent.strategy.feed.SignalChannel;
import com.tradingagent.strategy.impl.EdgeTakingStrategy;
import com.tradingagent.strategy.impl.SignalFollowStrategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the strategy beans enabled under {@code agent.strategies.*}. */
@Configuration
public class StrategyConfiguration {

    @Bean
    public StrategyContext strategyContext(
            PositionLedger positionLedger,
            RiskSizer riskSizer,
            ExposureTracker exposureTracker,
            BankrollService bankrollService,
            TradeSubmitter tradeSubmitter,
            AllocationBook allocationBook) {
        return StrategyContext.builder()
                .positionLedger(positionLedger)
                .riskSizer(riskSizer)
                .exposureTracker(exposureTracker)
                .bankrollService(bankrollService)
                .tradeSubmitter(tradeSubmitter)
                .allocationBook(allocationBook)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.strategies.edge-taking", name = "enabled", matchIfMissing = true)
    public EdgeTakingStrategy edgeTakingStrategy(
            StrategyContext strategyContext,
            ObjectProvider<OpportunitySource> sources,
            StrategyProperties strategyProperties) {
        return new EdgeTakingStrategy(
                strategyContext, sources.orderedStream().toList(), strategyProperties.getEdgeTaking());
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent.strategies.signal-follow", name = "enabled")
    public SignalFollowStrategy signalFollowStrategy(
            StrategyContext strategyContext, SignalChannel signalChannel, StrategyProperties strategyProperties) {
        return new SignalFollowStrategy(strategyContext, signalChannel, strategyProperties.getSignalFollow());
    }
}
