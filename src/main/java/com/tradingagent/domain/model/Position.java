package com.tradingagent.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tradingagent.domain.enums.PositionStatus;
import com.tradingagent.domain.enums.Side;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ledger row. The ledger keeps at most one row per ticker per universe; a closed row is
 * replaced when the ticker is opened again.
 *
 * <p>Prices are integer cents (1-99 on entry, 0-100 on exit). P&L is in dollars.
 * Persisted as snake_case JSON so ledger files written by earlier agent versions load unchanged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    private String ticker;
    private Side side;
    private int contracts;

    /** Cents paid per contract for the held side. */
    private int entryPrice;

    private LocalDateTime entryTime;
    private String strategy;
    private boolean simulated;
    private String marketTitle;

    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;

    /** Payout per contract of the held side at close, in cents. */
    private Integer exitPrice;

    private LocalDateTime exitTime;
    private BigDecimal pnl;

    /** When the market is expected to settle, if the strategy knows it. */
    private LocalDateTime expectedSettlement;

    @JsonIgnore
    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /** Dollars committed at entry. */
    @JsonIgnore
    public BigDecimal getNotional() {
        return BigDecimal.valueOf((long) entryPrice * contracts).movePointLeft(2);
    }
}
