package com.tradingagent.domain.model;

import lombok.Builder;
import lombok.Value;

/** Current view of a market as seen by a strategy, used to grade open positions. */
@Value
@Builder
public class MarketSnapshot {

    String ticker;

    /** Current price of the held side in cents. */
    int currentPrice;

    /** Remaining edge of the held side under the strategy's model. */
    double edge;

    boolean settled;
}
