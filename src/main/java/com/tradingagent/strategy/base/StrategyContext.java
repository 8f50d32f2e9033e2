package com.tradingagent.strategy.base;

import com.tradingagent.core.engine.AllocationBook;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.oms.TradeSubmitter;
import com.tradingagent.risk.BankrollService;
import com.tradingagent.risk.ExposureTracker;
import com.tradingagent.risk.RiskSizer;
import lombok.Builder;
import lombok.Getter;

/**
 * Services shared by every strategy. Strategies are built in {@code StrategyConfiguration} and
 * receive this bundle instead of injecting each service.
 */
@Getter
@Builder
public class StrategyContext {

    private final PositionLedger positionLedger;
    private final RiskSizer riskSizer;
    private final ExposureTracker exposureTracker;
    private final BankrollService bankrollService;
    private final TradeSubmitter tradeSubmitter;
    private final AllocationBook allocationBook;
}
