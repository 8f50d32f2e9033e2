package com.tradingagent.simulator;

import com.tradingagent.domain.enums.MarketStatus;
import com.tradingagent.domain.enums.OrderRejectReason;
import com.tradingagent.domain.enums.Side;
import com.tradingagent.exception.ExchangeException;
import com.tradingagent.exchange.ExchangeGateway;
import com.tradingagent.exchange.model.ExchangePosition;
import com.tradingagent.exchange.model.Market;
import com.tradingagent.exchange.model.MarketFilter;
import com.tradingagent.exchange.model.OrderResult;
import com.tradingagent.exchange.model.Orderbook;
import com.tradingagent.exchange.model.PriceLevel;
import com.tradingagent.exchange.model.SettlementStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * In-memory exchange for dry runs and tests.
 *
 * <p>Markets are registered with {@link #addMarket}. Limit buys on an open market fill
 * immediately at the limit price if the balance covers them. {@link #settleMarket} publishes a
 * result, pays out held contracts and removes the position, which is what reconciliation then
 * observes.
 *
 * <p>Active unless {@code agent.exchange.mode} selects another gateway.
 */
@Service
@ConditionalOnProperty(prefix = "agent.exchange", name = "mode", havingValue = "paper", matchIfMissing = true)
public class PaperExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeGateway.class);

    private final Map<String, Market> markets = new ConcurrentHashMap<>();
    private final Map<String, Integer> positions = new ConcurrentHashMap<>();
    private final Map<String, Integer> settlementPrices = new ConcurrentHashMap<>();
    private final AtomicLong balanceCents;
    private final AtomicLong orderSequence = new AtomicLong();

    public PaperExchangeGateway(@Value("${agent.exchange.paper-balance-cents:10000}") long startingBalanceCents) {
        this.balanceCents = new AtomicLong(startingBalanceCents);
    }

    // ---- Markets ----

    @Override
    public List<Market> getMarkets(MarketFilter filter) {
        return markets.values().stream()
                .filter(m -> filter.getSeriesTicker() == null || filter.getSeriesTicker().equals(m.getSeriesTicker()))
                .filter(m -> filter.getTicker() == null || filter.getTicker().equals(m.getTicker()))
                .filter(m -> filter.getStatus() == null || filter.getStatus() == m.getStatus())
                .limit(filter.getLimit())
                .toList();
    }

    @Override
    public Orderbook getOrderbook(String ticker) {
        Market market = requireMarket(ticker);
        List<PriceLevel> yes = new ArrayList<>();
        List<PriceLevel> no = new ArrayList<>();
        if (market.getYesBid() != null) {
            yes.add(new PriceLevel(market.getYesBid(), 100));
        }
        if (market.getYesAsk() != null) {
            no.add(new PriceLevel(100 - market.getYesAsk(), 100));
        }
        return Orderbook.builder().ticker(ticker).yes(yes).no(no).build();
    }

    @Override
    public SettlementStatus getSettlementStatus(String ticker) {
        Market market = requireMarket(ticker);
        return SettlementStatus.builder()
                .ticker(ticker)
                .status(market.getStatus())
                .settlementPrice(settlementPrices.get(ticker))
                .build();
    }

    // ---- Orders ----

    @Override
    public synchronized OrderResult placeOrder(String ticker, Side side, int priceCents, int count) {
        Market market = markets.get(ticker);
        if (market == null) {
            return OrderResult.rejected(OrderRejectReason.MARKET_NOT_FOUND, "Market not found: " + ticker, 404);
        }
        if (market.getStatus() != MarketStatus.OPEN) {
            return OrderResult.rejected(OrderRejectReason.MARKET_CLOSED, "Market closed: " + ticker, 400);
        }
        if (priceCents < 1 || priceCents > 99 || count <= 0) {
            return OrderResult.rejected(
                    OrderRejectReason.INVALID_ORDER, "Invalid order: " + count + " @ " + priceCents + "c", 400);
        }
        long cost = (long) priceCents * count;
        if (cost > balanceCents.get()) {
            return OrderResult.rejected(OrderRejectReason.INSUFFICIENT_FUNDS, "Insufficient balance", 400);
        }

        balanceCents.addAndGet(-cost);
        positions.merge(ticker, side == Side.YES ? count : -count, Integer::sum);
        String orderId = "paper-" + orderSequence.incrementAndGet();
        log.debug("Paper fill {}: {} {} x{} @ {}c", orderId, ticker, side, count, priceCents);
        return OrderResult.accepted(orderId);
    }

    // ---- Account ----

    @Override
    public List<ExchangePosition> getPositions() {
        return positions.entrySet().stream()
                .filter(e -> e.getValue() != 0)
                .map(e -> ExchangePosition.builder().ticker(e.getKey()).position(e.getValue()).build())
                .toList();
    }

    @Override
    public long getBalanceCents() {
        return balanceCents.get();
    }

    // ---- Simulation control ----

    public void addMarket(Market market) {
        markets.put(market.getTicker(), market);
    }

    public void setMarketStatus(String ticker, MarketStatus status) {
        requireMarket(ticker).setStatus(status);
    }

    /**
     * Publishes a YES settlement price, pays out the held contracts and removes the position.
     */
    public synchronized void settleMarket(String ticker, int yesSettlementPrice) {
        Market market = requireMarket(ticker);
        market.setStatus(MarketStatus.SETTLED);
        settlementPrices.put(ticker, yesSettlementPrice);
        Integer held = positions.remove(ticker);
        if (held != null && held != 0) {
            int payout = held > 0 ? yesSettlementPrice : 100 - yesSettlementPrice;
            balanceCents.addAndGet((long) Math.abs(held) * payout);
        }
        log.info("Paper market {} settled at {}c", ticker, yesSettlementPrice);
    }

    private Market requireMarket(String ticker) {
        Market market = markets.get(ticker);
        if (market == null) {
            throw new ExchangeException("Unknown market: " + ticker);
        }
        return market;
    }
}
