package com.tradingagent.event;

import com.tradingagent.domain.model.QueuedTrade;
import org.springframework.context.ApplicationEvent;

/** Outcome of one retry-queue entry leaving or re-entering the queue. */
public class RetryQueueEvent extends ApplicationEvent {

    public enum Outcome {
        QUEUED,
        SUCCEEDED,
        REQUEUED,
        EXPIRED,
        EXHAUSTED,
        REJECTED
    }

    private final QueuedTrade trade;
    private final Outcome outcome;

    public RetryQueueEvent(Object source, QueuedTrade trade, Outcome outcome) {
        super(source);
        this.trade = trade;
        this.outcome = outcome;
    }

    public QueuedTrade getTrade() {
        return trade;
    }

    public Outcome getOutcome() {
        return outcome;
    }
}
