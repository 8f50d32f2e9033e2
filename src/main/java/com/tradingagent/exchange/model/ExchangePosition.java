package com.tradingagent.exchange.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A position as held on the exchange. Positive contracts are YES, negative are NO. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangePosition {

    private String ticker;
    private int position;
    private long marketExposureCents;
}
