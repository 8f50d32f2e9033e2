package com.tradingagent.event;

import com.tradingagent.domain.model.ReconciliationResult;
import org.springframework.context.ApplicationEvent;

/** Published after every ledger/exchange sync, including aborted ones. */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;

    public ReconciliationEvent(Object source, ReconciliationResult result) {
        super(source);
        this.result = result;
    }

    public ReconciliationResult getResult() {
        return result;
    }
}
