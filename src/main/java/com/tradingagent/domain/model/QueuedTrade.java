package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.Side;
import com.tradingagent.domain.enums.Universe;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An order ticket. Strategies build one per trade; when the exchange rejects it transiently the
 * same ticket waits in the retry queue.
 *
 * <p>The ticker selector is resolved again on every attempt, so an entry queued against a market
 * window that had not opened yet lands in the window that is open when the retry runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueuedTrade {

    /** Who produced the signal (competitor account, feed name). */
    private String source;

    /** Series ticker or explicit market ticker to resolve at attempt time. */
    private String tickerSelector;

    /** Ticker of the last resolution. Null until the first successful resolution. */
    private String ticker;

    private Side side;
    private int priceCents;
    private int contracts;
    private Instant queuedAt;
    private int retryCount;

    private String strategy;
    private Universe universe;
    private String marketTitle;
    private LocalDateTime expectedSettlement;

    /** Exposure reserved for this order, released if the entry is dropped. */
    @Builder.Default
    private BigDecimal reservedNotional = BigDecimal.ZERO;
}
