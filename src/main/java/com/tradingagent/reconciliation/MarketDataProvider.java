package com.tradingagent.reconciliation;

import com.tradingagent.domain.model.MarketSnapshot;
import java.util.Optional;

/** Supplies the current view of a market for position grading. */
@FunctionalInterface
public interface MarketDataProvider {

    Optional<MarketSnapshot> snapshot(String ticker);
}
