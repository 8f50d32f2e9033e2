package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.Side;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A trade observed from an external source, fed to continuous strategies. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSignal {

    private String source;
    private String tickerSelector;
    private String marketTitle;
    private Side side;
    private int priceCents;
    private int contracts;
    private Instant observedAt;
}
