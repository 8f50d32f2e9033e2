package com.tradingagent.oms;

import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.QueuedTrade;
import com.tradingagent.event.RetryQueueEvent;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.risk.ExposureTracker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Holds order tickets whose market was not open when they were submitted.
 *
 * <p>Each {@link #processQueue()} pass takes a snapshot of the queue and handles every entry
 * once:
 * <ol>
 *   <li>older than {@code maxQueueAge}: dropped without an attempt</li>
 *   <li>{@code retryCount >= maxRetries}: dropped without an attempt</li>
 *   <li>otherwise {@code retryCount} is incremented and the order is attempted once; a transient
 *       failure puts it back, a permanent one drops it, a success records it in the ledger</li>
 * </ol>
 * Entries added while a pass runs wait for the next pass. Only one pass runs at a time; a caller
 * arriving during a pass returns immediately with no successes.
 */
@Component
public class RetryQueue {

    private static final Logger log = LoggerFactory.getLogger(RetryQueue.class);

    private final LinkedBlockingQueue<QueuedTrade> queue = new LinkedBlockingQueue<>();
    private final ReentrantLock passLock = new ReentrantLock();

    private final ExchangeOrderExecutor exchangeOrderExecutor;
    private final PositionLedger positionLedger;
    private final ExposureTracker exposureTracker;
    private final RetryQueueConfig retryQueueConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public RetryQueue(
            ExchangeOrderExecutor exchangeOrderExecutor,
            PositionLedger positionLedger,
            ExposureTracker exposureTracker,
            RetryQueueConfig retryQueueConfig,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.exchangeOrderExecutor = exchangeOrderExecutor;
        this.positionLedger = positionLedger;
        this.exposureTracker = exposureTracker;
        this.retryQueueConfig = retryQueueConfig;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public void enqueue(QueuedTrade trade) {
        if (trade.getQueuedAt() == null) {
            trade.setQueuedAt(clock.instant());
        }
        queue.offer(trade);
        eventPublisher.publishEvent(new RetryQueueEvent(this, trade, RetryQueueEvent.Outcome.QUEUED));
        log.info("Queued {} {} x{} @ {}c for retry (source={}, queueSize={})",
                selectorOf(trade), trade.getSide(), trade.getContracts(), trade.getPriceCents(),
                trade.getSource(), queue.size());
    }

    /**
     * Runs one pass over the queued entries.
     *
     * @return positions opened by this pass
     */
    public List<Position> processQueue() {
        if (!passLock.tryLock()) {
            log.debug("Retry pass already running, skipping");
            return List.of();
        }
        try {
            List<QueuedTrade> batch = new ArrayList<>();
            queue.drainTo(batch);
            if (batch.isEmpty()) {
                return List.of();
            }

            List<Position> successes = new ArrayList<>();
            Instant now = clock.instant();
            for (QueuedTrade trade : batch) {
                try {
                    processEntry(trade, now).ifPresent(successes::add);
                } catch (RuntimeException e) {
                    log.error("Retry of {} failed unexpectedly, dropping: {}", selectorOf(trade), e.getMessage(), e);
                    drop(trade, RetryQueueEvent.Outcome.REJECTED);
                }
            }
            log.info("Retry pass: {} entries, {} filled, {} still queued", batch.size(), successes.size(), queue.size());
            return successes;
        } finally {
            passLock.unlock();
        }
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /** Copy of the current entries, for monitoring. */
    public List<QueuedTrade> snapshot() {
        return new ArrayList<>(queue);
    }

    private Optional<Position> processEntry(QueuedTrade trade, Instant now) {
        Duration age = Duration.between(trade.getQueuedAt(), now);
        if (age.compareTo(retryQueueConfig.getMaxQueueAge()) > 0) {
            log.warn("Dropping expired retry {} (age {}s, {} attempts)",
                    selectorOf(trade), age.toSeconds(), trade.getRetryCount());
            drop(trade, RetryQueueEvent.Outcome.EXPIRED);
            return Optional.empty();
        }
        if (trade.getRetryCount() >= retryQueueConfig.getMaxRetries()) {
            log.warn("Dropping retry {} after {} attempts", selectorOf(trade), trade.getRetryCount());
            drop(trade, RetryQueueEvent.Outcome.EXHAUSTED);
            return Optional.empty();
        }

        trade.setRetryCount(trade.getRetryCount() + 1);
        OrderOutcome outcome = exchangeOrderExecutor.execute(trade);
        switch (outcome.getKind()) {
            case SUCCESS -> {
                eventPublisher.publishEvent(new RetryQueueEvent(this, trade, RetryQueueEvent.Outcome.SUCCEEDED));
                Optional<Position> opened = positionLedger.openPosition(
                        outcome.getTicker(), trade.getSide(), trade.getContracts(), trade.getPriceCents(),
                        trade.getStrategy(), trade.getUniverse(), trade.getMarketTitle(), true,
                        trade.getExpectedSettlement());
                if (opened.isEmpty()) {
                    exposureTracker.release(trade.getUniverse(), trade.getReservedNotional());
                }
                return opened;
            }
            case TRANSIENT -> {
                log.info("Retry {} attempt {} still transient: {}",
                        selectorOf(trade), trade.getRetryCount(), outcome.getMessage());
                queue.offer(trade);
                eventPublisher.publishEvent(new RetryQueueEvent(this, trade, RetryQueueEvent.Outcome.REQUEUED));
                return Optional.empty();
            }
            default -> {
                log.warn("Dropping retry {} on permanent rejection: {}", selectorOf(trade), outcome.getMessage());
                drop(trade, RetryQueueEvent.Outcome.REJECTED);
                return Optional.empty();
            }
        }
    }

    private void drop(QueuedTrade trade, RetryQueueEvent.Outcome outcome) {
        exposureTracker.release(trade.getUniverse(), trade.getReservedNotional());
        eventPublisher.publishEvent(new RetryQueueEvent(this, trade, outcome));
    }

    private static String selectorOf(QueuedTrade trade) {
        return trade.getTickerSelector() != null ? trade.getTickerSelector() : trade.getTicker();
    }
}
