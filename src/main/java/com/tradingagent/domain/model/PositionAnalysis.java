package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.Recommendation;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionAnalysis {

    Position position;
    int currentPrice;
    double pnlPct;
    double edge;
    Recommendation recommendation;
    String reason;
}
