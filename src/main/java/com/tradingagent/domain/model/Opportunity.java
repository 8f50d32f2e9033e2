package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.Side;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A candidate trade found by a scan. Probability and edge come from the strategy's own model. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Opportunity {

    private String ticker;

    /** Series to resolve at order time when the exact market is not known yet. */
    private String tickerSelector;

    private String marketTitle;
    private Side side;
    private int priceCents;

    /** Model probability that the chosen side pays out. */
    private double winProbability;

    /** winProbability minus the implied probability of the price. */
    private double edge;

    private String source;

    /** Fixed contract count requested by the signal; 0 means size by risk. */
    private int contracts;
    private LocalDateTime expectedSettlement;

    /** Decimal odds of buying the side at {@code priceCents}. */
    public double getOdds() {
        return 100.0 / priceCents;
    }
}
