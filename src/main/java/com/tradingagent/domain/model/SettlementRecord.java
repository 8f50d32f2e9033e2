package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.SettlementState;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** What reconciliation concluded for one locally open ticker missing from the exchange. */
@Value
@Builder
public class SettlementRecord {

    String ticker;
    SettlementState state;
    Integer settlementPrice;
    BigDecimal pnl;
    String detail;
}
