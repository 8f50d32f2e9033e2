package com.tradingagent.oms;

import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.QueuedTrade;
import com.tradingagent.exception.PersistenceException;
import com.tradingagent.exchange.TickerResolver;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.risk.ExposureTracker;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single path from a sized order ticket to a ledger row.
 *
 * <p>Simulated tickets never reach the exchange: the ticker is resolved and the position is
 * recorded directly. Live tickets are placed on the exchange; a fill is recorded in the real
 * ledger, a transient rejection goes to the {@link RetryQueue} and a permanent one is dropped.
 * Whenever a ticket ends without a position, its reserved exposure is released.
 */
@Service
public class TradeSubmitter {

    private static final Logger log = LoggerFactory.getLogger(TradeSubmitter.class);

    private final ExchangeOrderExecutor exchangeOrderExecutor;
    private final RetryQueue retryQueue;
    private final PositionLedger positionLedger;
    private final ExposureTracker exposureTracker;
    private final TickerResolver tickerResolver;

    public TradeSubmitter(
            ExchangeOrderExecutor exchangeOrderExecutor,
            RetryQueue retryQueue,
            PositionLedger positionLedger,
            ExposureTracker exposureTracker,
            TickerResolver tickerResolver) {
        this.exchangeOrderExecutor = exchangeOrderExecutor;
        this.retryQueue = retryQueue;
        this.positionLedger = positionLedger;
        this.exposureTracker = exposureTracker;
        this.tickerResolver = tickerResolver;
    }

    public SubmissionResult submit(QueuedTrade trade) {
        return trade.getUniverse().isSimulated() ? recordSimulated(trade) : placeLive(trade);
    }

    /** Drains the retry backlog. Called before new signals are ingested. */
    public List<Position> drainRetryQueue() {
        return retryQueue.processQueue();
    }

    private SubmissionResult recordSimulated(QueuedTrade trade) {
        String ticker = trade.getTicker();
        if (ticker == null) {
            try {
                ticker = tickerResolver.resolve(trade.getTickerSelector()).orElse(null);
            } catch (RuntimeException e) {
                log.warn("Could not resolve {} for simulated trade: {}", trade.getTickerSelector(), e.getMessage());
            }
        }
        if (ticker == null) {
            release(trade);
            return SubmissionResult.of(
                    SubmissionResult.Status.REJECTED, "No open market for " + trade.getTickerSelector());
        }
        trade.setTicker(ticker);
        return record(trade, ticker);
    }

    private SubmissionResult placeLive(QueuedTrade trade) {
        OrderOutcome outcome = exchangeOrderExecutor.execute(trade);
        return switch (outcome.getKind()) {
            case SUCCESS -> record(trade, outcome.getTicker());
            case TRANSIENT -> {
                retryQueue.enqueue(trade);
                yield SubmissionResult.of(SubmissionResult.Status.QUEUED, outcome.getMessage());
            }
            case PERMANENT -> {
                log.warn("Dropping {} order for {}: {}", trade.getStrategy(), outcome.getTicker(), outcome.getMessage());
                release(trade);
                yield SubmissionResult.of(SubmissionResult.Status.REJECTED, outcome.getMessage());
            }
        };
    }

    private SubmissionResult record(QueuedTrade trade, String ticker) {
        Optional<Position> opened;
        try {
            opened = positionLedger.openPosition(
                    ticker, trade.getSide(), trade.getContracts(), trade.getPriceCents(), trade.getStrategy(),
                    trade.getUniverse(), trade.getMarketTitle(), true, trade.getExpectedSettlement());
        } catch (PersistenceException e) {
            log.error("{} fill on {} could not be recorded in the {} ledger",
                    trade.getStrategy(), ticker, trade.getUniverse(), e);
            release(trade);
            throw e;
        }
        if (opened.isEmpty()) {
            release(trade);
            return SubmissionResult.of(SubmissionResult.Status.DUPLICATE, "Position already open on " + ticker);
        }
        return SubmissionResult.builder()
                .status(SubmissionResult.Status.OPENED)
                .position(opened.get())
                .build();
    }

    private void release(QueuedTrade trade) {
        exposureTracker.release(trade.getUniverse(), trade.getReservedNotional());
    }
}
