package com.tradingagent.domain.model;

import com.tradingagent.domain.enums.SettlementState;
import com.tradingagent.domain.enums.Universe;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of one sync between the ledger and the exchange. When the exchange position fetch fails
 * the result is marked aborted and carries no records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private LocalDateTime timestamp;
    private String strategy;
    private Universe universe;
    private int localOpenCount;
    private int exchangeCount;
    private boolean aborted;
    private String abortReason;

    @Builder.Default
    private List<SettlementRecord> records = new ArrayList<>();

    private Duration duration;

    public long count(SettlementState state) {
        return records.stream().filter(r -> r.getState() == state).count();
    }

    public boolean hasUnknown() {
        return count(SettlementState.UNKNOWN) > 0;
    }
}
