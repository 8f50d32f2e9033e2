package com.tradingagent.exchange;

import com.tradingagent.domain.enums.MarketStatus;
import com.tradingagent.exchange.model.Market;
import com.tradingagent.exchange.model.MarketFilter;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a ticker selector into the ticker of a currently open market.
 *
 * <p>A selector is either a series ticker, resolved to the open market in that series closing
 * soonest, or an exact market ticker, accepted only while that market is open.
 */
@Component
public class TickerResolver {

    private static final Logger log = LoggerFactory.getLogger(TickerResolver.class);

    private final ExchangeGateway exchangeGateway;

    public TickerResolver(ExchangeGateway exchangeGateway) {
        this.exchangeGateway = exchangeGateway;
    }

    /**
     * @return the open market ticker, or empty when nothing open matches right now
     * @throws com.tradingagent.exception.ExchangeException if the market listing fails
     */
    public Optional<String> resolve(String selector) {
        if (selector == null || selector.isBlank()) {
            return Optional.empty();
        }
        List<Market> seriesMarkets = exchangeGateway.getMarkets(MarketFilter.openInSeries(selector));
        Optional<String> inSeries = seriesMarkets.stream()
                .filter(m -> m.getStatus() == MarketStatus.OPEN)
                .min(Comparator.comparing(m -> m.getCloseTime() != null ? m.getCloseTime() : Instant.MAX))
                .map(Market::getTicker);
        if (inSeries.isPresent()) {
            log.debug("Selector {} resolved to {}", selector, inSeries.get());
            return inSeries;
        }
        return exchangeGateway.getMarkets(MarketFilter.byTicker(selector)).stream()
                .filter(m -> selector.equals(m.getTicker()) && m.getStatus() == MarketStatus.OPEN)
                .map(Market::getTicker)
                .findFirst();
    }
}
