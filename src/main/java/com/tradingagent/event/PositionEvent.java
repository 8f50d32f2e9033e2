package com.tradingagent.event;

import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the position ledger after a mutation has been persisted.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>ExposureTracker: releases notional when a position closes</li>
 *   <li>RiskSizer: feeds realized P&L into the daily loss tally</li>
 *   <li>TradingMetrics: open/close counters</li>
 * </ul>
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final Universe universe;
    private final PositionEventType eventType;

    public PositionEvent(Object source, Position position, Universe universe, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.universe = universe;
        this.eventType = eventType;
    }

    /** Copy of the row as persisted. */
    public Position getPosition() {
        return position;
    }

    public Universe getUniverse() {
        return universe;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
