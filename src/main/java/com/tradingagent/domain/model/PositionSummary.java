package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.Universe;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionSummary {

    String strategy;
    Universe universe;
    int openPositions;
    int openContracts;
    BigDecimal openNotional;
    List<Position> positions;
    PerformanceSummary performance;
}
