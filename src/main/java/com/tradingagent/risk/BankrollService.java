package com.tradingagent.risk;

import com.tradingagent.domain.enums.Universe;
import com.tradingagent.exchange.ExchangeGateway;
import com.tradingagent.ledger.PositionLedger;
import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Current bankroll per universe. Live bankroll is the exchange balance; simulated bankroll is the
 * initial bankroll plus realized simulated P&L.
 */
@Service
public class BankrollService {

    private static final Logger log = LoggerFactory.getLogger(BankrollService.class);

    private final ExchangeGateway exchangeGateway;
    private final PositionLedger positionLedger;
    private final RiskSizingConfig riskSizingConfig;
    private final AtomicReference<BigDecimal> lastLiveBankroll = new AtomicReference<>();

    public BankrollService(
            ExchangeGateway exchangeGateway, PositionLedger positionLedger, RiskSizingConfig riskSizingConfig) {
        this.exchangeGateway = exchangeGateway;
        this.positionLedger = positionLedger;
        this.riskSizingConfig = riskSizingConfig;
    }

    public BigDecimal currentBankroll(Universe universe) {
        if (universe.isSimulated()) {
            return riskSizingConfig.getInitialBankroll().add(positionLedger.realizedPnl(Universe.SIMULATED));
        }
        try {
            BigDecimal balance = BigDecimal.valueOf(exchangeGateway.getBalanceCents()).movePointLeft(2);
            lastLiveBankroll.set(balance);
            return balance;
        } catch (RuntimeException e) {
            BigDecimal fallback = lastLiveBankroll.get() != null
                    ? lastLiveBankroll.get()
                    : riskSizingConfig.getInitialBankroll();
            log.warn("Balance fetch failed, using last known bankroll ${}: {}", fallback, e.getMessage());
            return fallback;
        }
    }
}
