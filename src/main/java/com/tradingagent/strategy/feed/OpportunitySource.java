package com.tradingagent.strategy.feed;

import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.Opportunity;
import java.util.List;
import java.util.Optional;

/**
 * Produces priced, probability-rated opportunities from an external model (weather forecasts,
 * spot price feeds). Register implementations as beans to feed the edge-taking strategy.
 */
public interface OpportunitySource {

    String getName();

    List<Opportunity> fetchOpportunities();

    default Optional<MarketSnapshot> snapshot(String ticker) {
        return Optional.empty();
    }
}
