package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.RiskLevel;
import lombok.Builder;
import lombok.Value;

/** Sizing parameters for the current bankroll tier. */
@Value
@Builder
public class RiskProfile {

    RiskLevel level;

    /** Upper bound on one position as a fraction of bankroll. */
    double maxPositionPct;

    /** Trades whose expected value is below this are skipped. */
    double minEvThreshold;

    /** Fraction of full Kelly to bet. */
    double kellyMultiplier;
}
