package com.tradingagent.exchange.model;

import com.tradingagent.domain.enums.MarketStatus;
import lombok.Builder;
import lombok.Value;

/** Query for {@code getMarkets}. Null fields are not filtered on. */
@Value
@Builder
public class MarketFilter {

    String seriesTicker;
    String ticker;
    MarketStatus status;

    @Builder.Default
    int limit = 100;

    public static MarketFilter openInSeries(String seriesTicker) {
        return MarketFilter.builder().seriesTicker(seriesTicker).status(MarketStatus.OPEN).build();
    }

    public static MarketFilter byTicker(String ticker) {
        return MarketFilter.builder().ticker(ticker).build();
    }
}
