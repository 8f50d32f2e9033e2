package com.tradingagent.domain.enums;

/**
 * CYCLIC strategies are driven by the scheduler: scan, execute, sleep. CONTINUOUS strategies own
 * their loop and are only started and cancelled by the scheduler.
 */
public enum ExecutionMode {
    CYCLIC,
    CONTINUOUS
}
