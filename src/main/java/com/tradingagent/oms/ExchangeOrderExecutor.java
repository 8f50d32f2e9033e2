package com.tradingagent.oms;

import com.tradingagent.domain.enums.OrderRejectReason;
import com.tradingagent.domain.model.QueuedTrade;
import com.tradingagent.exchange.ExchangeGateway;
import com.tradingagent.exchange.TickerResolver;
import com.tradingagent.exchange.model.OrderResult;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Places one order ticket on the exchange. The ticker is resolved from the ticket's selector at
 * attempt time and written back to the ticket.
 */
@Component
public class ExchangeOrderExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExchangeOrderExecutor.class);

    private final ExchangeGateway exchangeGateway;
    private final TickerResolver tickerResolver;
    private final OrderFailureClassifier orderFailureClassifier;

    public ExchangeOrderExecutor(
            ExchangeGateway exchangeGateway,
            TickerResolver tickerResolver,
            OrderFailureClassifier orderFailureClassifier) {
        this.exchangeGateway = exchangeGateway;
        this.tickerResolver = tickerResolver;
        this.orderFailureClassifier = orderFailureClassifier;
    }

    public OrderOutcome execute(QueuedTrade trade) {
        String selector = trade.getTickerSelector() != null ? trade.getTickerSelector() : trade.getTicker();
        Optional<String> ticker;
        try {
            ticker = tickerResolver.resolve(selector);
        } catch (RuntimeException e) {
            log.error("Ticker resolution failed for {}: {}", selector, e.getMessage(), e);
            return OrderOutcome.failure(OrderOutcome.Kind.PERMANENT, null, OrderRejectReason.UNKNOWN, e.getMessage());
        }
        if (ticker.isEmpty()) {
            return OrderOutcome.failure(
                    OrderOutcome.Kind.TRANSIENT, null, OrderRejectReason.MARKET_NOT_FOUND,
                    "No open market for " + selector);
        }
        trade.setTicker(ticker.get());

        OrderResult result;
        try {
            result = exchangeGateway.placeOrder(
                    ticker.get(), trade.getSide(), trade.getPriceCents(), trade.getContracts());
        } catch (RuntimeException e) {
            log.error("Order placement failed for {}: {}", ticker.get(), e.getMessage(), e);
            return OrderOutcome.failure(
                    OrderOutcome.Kind.PERMANENT, ticker.get(), OrderRejectReason.UNKNOWN, e.getMessage());
        }

        OrderOutcome.Kind kind = orderFailureClassifier.classify(result);
        if (kind == OrderOutcome.Kind.SUCCESS) {
            log.info("Order placed: {} {} x{} @ {}c, id={}",
                    ticker.get(), trade.getSide(), trade.getContracts(), trade.getPriceCents(), result.getOrderId());
            return OrderOutcome.success(ticker.get(), result.getOrderId());
        }
        log.warn("Order rejected ({}): {} {} - {}", kind, ticker.get(), result.getRejectReason(), result.getError());
        return OrderOutcome.failure(kind, ticker.get(), result.getRejectReason(), result.getError());
    }
}
