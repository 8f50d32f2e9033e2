package com.tradingagent.domain.enums;

/**
 * Reconciliation state of an open position.
 *
 * <p>OPEN = still held on the exchange. FINALIZED = the exchange stopped trading the market but
 * has not published a result; the position stays open. SETTLED = a settlement price was
 * published and the position was closed. UNKNOWN = the position vanished from the exchange and
 * the status query was ambiguous; no mutation is made.
 */
public enum SettlementState {
    OPEN,
    FINALIZED,
    SETTLED,
    UNKNOWN
}
