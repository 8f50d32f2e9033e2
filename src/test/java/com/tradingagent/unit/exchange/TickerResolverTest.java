package com.tradingagent.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingagent.domain.enums.MarketStatus;
import com.tradingagent.exchange.TickerResolver;
import com.tradingagent.exchange.model.Market;
import com.tradingagent.simulator.PaperExchangeGateway;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TickerResolverTest {

    private static final Instant NOW = Instant.parse("2026-10-18T14:00:00Z");

    private PaperExchangeGateway gateway;
    private TickerResolver resolver;

    @BeforeEach
    void setUp() {
        gateway = new PaperExchangeGateway(10_000);
        resolver = new TickerResolver(gateway);
    }

    private void market(String ticker, String series, MarketStatus status, Instant closeTime) {
        gateway.addMarket(Market.builder()
                .ticker(ticker)
                .seriesTicker(series)
                .status(status)
                .closeTime(closeTime)
                .build());
    }

    @Test
    @DisplayName("A series selector resolves to the open market closing soonest")
    void seriesResolvesToSoonest() {
        market("KXBTC15M-1415", "KXBTC15M", MarketStatus.OPEN, NOW.plusSeconds(900));
        market("KXBTC15M-1430", "KXBTC15M", MarketStatus.OPEN, NOW.plusSeconds(1800));
        market("KXBTC15M-1400", "KXBTC15M", MarketStatus.CLOSED, NOW);

        assertThat(resolver.resolve("KXBTC15M")).contains("KXBTC15M-1415");
    }

    @Test
    @DisplayName("An exact ticker resolves only while its market is open")
    void exactTicker() {
        market("KXBTC15M-1415", "KXBTC15M", MarketStatus.OPEN, NOW.plusSeconds(900));

        assertThat(resolver.resolve("KXBTC15M-1415")).contains("KXBTC15M-1415");

        gateway.setMarketStatus("KXBTC15M-1415", MarketStatus.CLOSED);
        assertThat(resolver.resolve("KXBTC15M-1415")).isEmpty();
    }

    @Test
    @DisplayName("Nothing open means nothing resolved")
    void nothingOpen() {
        assertThat(resolver.resolve("KXBTC15M")).isEmpty();
        assertThat(resolver.resolve(" ")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }
}
