package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.Side;
import lombok.Builder;
import lombok.Value;

/** Buy the opposite side to lock in part of a position's move. */
@Value
@Builder
public class HedgeRecommendation {

    String ticker;
    Side originalSide;
    Side hedgeSide;
    int hedgeSize;
    double pnlPct;
    String reason;
}
