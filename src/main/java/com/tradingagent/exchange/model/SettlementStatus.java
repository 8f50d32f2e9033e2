package com.tradingagent.exchange.model;

import com.tradingagent.domain.enums.MarketStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Settlement view of a market. {@code settlementPrice} is the YES payout in cents (0 or 100 for
 * a binary result) and is only meaningful when {@code status} is SETTLED.
 */
@Value
@Builder
public class SettlementStatus {

    String ticker;
    MarketStatus status;
    Integer settlementPrice;
}
