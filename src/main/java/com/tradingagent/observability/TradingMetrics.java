package com.tradingagent.observability;

import com.tradingagent.domain.enums.SettlementState;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.event.PositionEvent;
import com.tradingagent.event.PositionEventType;
import com.tradingagent.event.ReconciliationEvent;
import com.tradingagent.event.RetryQueueEvent;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.oms.RetryQueue;
import com.tradingagent.risk.ExposureTracker;
import com.tradingagent.risk.RiskSizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the agent, exposed through the actuator.
 * <ul>
 *   <li><b>agent.positions.opened / closed</b> (counter, tag universe)</li>
 *   <li><b>agent.retry.outcomes</b> (counter, tag outcome)</li>
 *   <li><b>agent.reconciliation.unknown</b> (counter): positions flagged for manual review</li>
 *   <li><b>agent.retry.queue.size</b>, <b>agent.positions.open</b>, <b>agent.exposure</b>,
 *       <b>agent.daily.loss</b> (gauges)</li>
 * </ul>
 */
@Service
public class TradingMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<Universe, Counter> openedCounters = new EnumMap<>(Universe.class);
    private final Map<Universe, Counter> closedCounters = new EnumMap<>(Universe.class);
    private final Counter reconciliationUnknownCounter;

    public TradingMetrics(
            MeterRegistry meterRegistry,
            RetryQueue retryQueue,
            PositionLedger positionLedger,
            ExposureTracker exposureTracker,
            RiskSizer riskSizer) {
        this.meterRegistry = meterRegistry;
        for (Universe universe : Universe.values()) {
            String tag = universe.name().toLowerCase();
            openedCounters.put(universe, Counter.builder("agent.positions.opened")
                    .description("Positions opened in the ledger")
                    .tag("universe", tag)
                    .register(meterRegistry));
            closedCounters.put(universe, Counter.builder("agent.positions.closed")
                    .description("Positions closed in the ledger")
                    .tag("universe", tag)
                    .register(meterRegistry));

            Tags tags = Tags.of("universe", tag);
            meterRegistry.gauge("agent.positions.open", tags, positionLedger,
                    ledger -> ledger.getOpenPositions(null, universe).size());
            meterRegistry.gauge("agent.exposure", tags, exposureTracker,
                    tracker -> tracker.getExposure(universe).doubleValue());
            meterRegistry.gauge("agent.daily.loss", tags, riskSizer,
                    sizer -> sizer.getDailyLoss(universe).doubleValue());
        }
        this.reconciliationUnknownCounter = Counter.builder("agent.reconciliation.unknown")
                .description("Positions that vanished from the exchange without a settlement result")
                .register(meterRegistry);
        meterRegistry.gauge("agent.retry.queue.size", retryQueue, RetryQueue::size);
    }

    @EventListener
    public void onPositionEvent(PositionEvent event) {
        Map<Universe, Counter> counters =
                event.getEventType() == PositionEventType.OPENED ? openedCounters : closedCounters;
        counters.get(event.getUniverse()).increment();
    }

    @EventListener
    public void onRetryQueueEvent(RetryQueueEvent event) {
        meterRegistry.counter("agent.retry.outcomes", "outcome", event.getOutcome().name().toLowerCase())
                .increment();
    }

    @EventListener
    public void onReconciliationEvent(ReconciliationEvent event) {
        long unknown = event.getResult().count(SettlementState.UNKNOWN);
        if (unknown > 0) {
            reconciliationUnknownCounter.increment(unknown);
        }
    }
}
