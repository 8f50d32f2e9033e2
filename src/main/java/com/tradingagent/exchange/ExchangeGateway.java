package com.tradingagent.exchange;

import com.tradingagent.domain.enums.Side;
import com.tradingagent.exchange.model.ExchangePosition;
import com.tradingagent.exchange.model.Market;
import com.tradingagent.exchange.model.MarketFilter;
import com.tradingagent.exchange.model.OrderResult;
import com.tradingagent.exchange.model.Orderbook;
import com.tradingagent.exchange.model.SettlementStatus;
import java.util.List;

/**
 * Everything the agent needs from the exchange. Request signing and transport retry belong to
 * the implementation; callers see domain objects and {@link com.tradingagent.exception.ExchangeException}.
 *
 * <p>The bundled implementation is {@code PaperExchangeGateway}, an in-memory exchange used for
 * dry runs and tests. A live client implements the same interface.
 */
public interface ExchangeGateway {

    // ---- Markets ----

    /**
     * Lists markets matching the filter.
     *
     * @throws com.tradingagent.exception.ExchangeException if the exchange cannot be reached
     */
    List<Market> getMarkets(MarketFilter filter);

    /**
     * Current orderbook of one market.
     *
     * @throws com.tradingagent.exception.ExchangeException if the market is unknown or unreachable
     */
    Orderbook getOrderbook(String ticker);

    /**
     * Settlement status of one market, used to decide whether a position that disappeared from
     * the exchange can be closed.
     *
     * @throws com.tradingagent.exception.ExchangeException if the status cannot be fetched
     */
    SettlementStatus getSettlementStatus(String ticker);

    // ---- Orders ----

    /**
     * Places a limit buy of {@code count} contracts of {@code side} at {@code priceCents}.
     * Rejections come back in the result, not as exceptions.
     *
     * @throws com.tradingagent.exception.ExchangeException on transport failure
     */
    OrderResult placeOrder(String ticker, Side side, int priceCents, int count);

    // ---- Account ----

    /**
     * All positions currently held on the exchange.
     *
     * @throws com.tradingagent.exception.ExchangeException if the positions cannot be fetched
     */
    List<ExchangePosition> getPositions();

    /**
     * Available balance in cents.
     *
     * @throws com.tradingagent.exception.ExchangeException if the balance cannot be fetched
     */
    long getBalanceCents();
}
