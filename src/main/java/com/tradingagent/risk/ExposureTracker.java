package com.tradingagent.risk;

import com.tradingagent.domain.enums.Universe;
import com.tradingagent.event.PositionEvent;
import com.tradingagent.event.PositionEventType;
import com.tradingagent.ledger.PositionLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Tracks open notional per universe and caps it at {@code maxExposurePct * bankroll}.
 *
 * <p>A trade reserves its notional before it is submitted. The reservation is released when the
 * position closes, or by the caller when the submission never produces a position (duplicate,
 * dropped retry, zero contracts).
 */
@Component
public class ExposureTracker {

    private static final Logger log = LoggerFactory.getLogger(ExposureTracker.class);

    private final RiskSizingConfig riskSizingConfig;
    private final Map<Universe, BigDecimal> exposure = new EnumMap<>(Universe.class);

    public ExposureTracker(RiskSizingConfig riskSizingConfig, PositionLedger positionLedger) {
        this.riskSizingConfig = riskSizingConfig;
        for (Universe universe : Universe.values()) {
            exposure.put(universe, positionLedger.openNotional(universe));
        }
        log.info("Exposure seeded from ledger: {}", exposure);
    }

    /**
     * Reserves up to {@code candidate} dollars of exposure.
     *
     * @return the granted amount: the candidate, the remaining headroom if smaller, or zero
     */
    public synchronized BigDecimal reserve(Universe universe, BigDecimal candidate, BigDecimal bankroll) {
        if (candidate.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal limit = bankroll.multiply(BigDecimal.valueOf(riskSizingConfig.getMaxExposurePct()));
        BigDecimal current = exposure.get(universe);
        BigDecimal headroom = limit.subtract(current);
        if (headroom.signum() <= 0) {
            log.info("{} exposure ${} at limit ${}, rejecting ${}", universe, current, limit, candidate);
            return BigDecimal.ZERO;
        }
        BigDecimal granted = candidate.min(headroom).setScale(2, RoundingMode.DOWN);
        if (granted.compareTo(candidate) < 0) {
            log.info("{} exposure headroom ${}: reduced ${} to ${}", universe, headroom, candidate, granted);
        }
        exposure.put(universe, current.add(granted));
        return granted;
    }

    public synchronized void release(Universe universe, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return;
        }
        BigDecimal next = exposure.get(universe).subtract(amount);
        exposure.put(universe, next.max(BigDecimal.ZERO));
    }

    public synchronized BigDecimal getExposure(Universe universe) {
        return exposure.get(universe);
    }

    @EventListener
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.CLOSED) {
            release(event.getUniverse(), event.getPosition().getNotional());
        }
    }
}
