package com.tradingagent.exchange.model;

import com.tradingagent.domain.enums.MarketStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Market {

    private String ticker;
    private String seriesTicker;
    private String title;
    private MarketStatus status;
    private Instant closeTime;
    private Integer yesBid;
    private Integer yesAsk;
}
