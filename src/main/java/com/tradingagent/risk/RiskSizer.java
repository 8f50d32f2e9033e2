package com.tradingagent.risk;

import com.tradingagent.domain.enums.RiskLevel;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.RiskProfile;
import com.tradingagent.event.PositionEvent;
import com.tradingagent.event.PositionEventType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Bankroll-aware position sizing and the trading circuit breaker.
 *
 * <p>Profiles are chosen by bankroll relative to the initial bankroll, loosening as the bankroll
 * grows and the trailing win rate improves:
 * <pre>
 *   ratio &lt; 0.8                   tight                 1% cap, EV 0.10, Kelly x0.10
 *   ratio &lt; 1.0                   conservative          2% cap, EV 0.07, Kelly x0.15
 *   ratio &lt; 1.5, win rate &gt; 0.55  moderate-aggressive   4% cap, EV 0.05, Kelly x0.25
 *   ratio &lt; 1.5                   moderate              3% cap, EV 0.05, Kelly x0.20
 *   ratio &gt;= 1.5, win rate &gt; 0.60 aggressive            5% cap, EV 0.04, Kelly x0.30
 *   ratio &gt;= 1.5                  moderate-aggressive
 * </pre>
 *
 * <p>Realized losses are tallied per universe from {@link PositionEvent}s so a dry-run strategy
 * cannot trip the breaker of live trading and vice versa.
 */
@Service
public class RiskSizer {

    private static final Logger log = LoggerFactory.getLogger(RiskSizer.class);

    private static final RiskProfile TIGHT = profile(RiskLevel.TIGHT, 0.01, 0.10, 0.10);
    private static final RiskProfile CONSERVATIVE = profile(RiskLevel.CONSERVATIVE, 0.02, 0.07, 0.15);
    private static final RiskProfile MODERATE = profile(RiskLevel.MODERATE, 0.03, 0.05, 0.20);
    private static final RiskProfile MODERATE_AGGRESSIVE = profile(RiskLevel.MODERATE_AGGRESSIVE, 0.04, 0.05, 0.25);
    private static final RiskProfile AGGRESSIVE = profile(RiskLevel.AGGRESSIVE, 0.05, 0.04, 0.30);

    /** Below this, sizes round to 10 cents; at or above, to whole dollars. */
    private static final BigDecimal FINE_ROUNDING_LIMIT = new BigDecimal("5");

    private final RiskSizingConfig riskSizingConfig;
    private final Map<Universe, AtomicReference<BigDecimal>> dailyLoss = new EnumMap<>(Universe.class);

    private int consecutiveWins;
    private int consecutiveLosses;

    public RiskSizer(RiskSizingConfig riskSizingConfig) {
        this.riskSizingConfig = riskSizingConfig;
        for (Universe universe : Universe.values()) {
            dailyLoss.put(universe, new AtomicReference<>(BigDecimal.ZERO));
        }
    }

    // ========================
    // PROFILE AND SIZING
    // ========================

    public RiskProfile getRiskProfile(BigDecimal bankroll, double winRate) {
        double ratio = bankroll.doubleValue() / riskSizingConfig.getInitialBankroll().doubleValue();
        if (ratio < 0.8) {
            return TIGHT;
        }
        if (ratio < 1.0) {
            return CONSERVATIVE;
        }
        if (ratio < 1.5) {
            return winRate > 0.55 ? MODERATE_AGGRESSIVE : MODERATE;
        }
        return winRate > 0.60 ? AGGRESSIVE : MODERATE_AGGRESSIVE;
    }

    /**
     * Expected value per dollar of buying at decimal {@code odds} with win probability {@code p}:
     * {@code p * (odds - 1) - (1 - p)}.
     */
    public double calculateEv(double winProbability, double odds) {
        return winProbability * (odds - 1) - (1 - winProbability);
    }

    /**
     * Dollars to commit to a trade with the given expected value and decimal odds.
     *
     * <p>The win probability implied by {@code ev} and {@code odds} is {@code (ev + 1) / odds};
     * full Kelly is {@code (p * odds - (1 - p)) / odds}. The result is scaled by the profile's
     * Kelly multiplier, capped at {@code maxPositionPct * bankroll} and rounded down, so it never
     * exceeds the cap. Returns zero for non-positive Kelly or sizes under the minimum trade.
     */
    public BigDecimal calculatePositionSize(BigDecimal bankroll, double winRate, double ev, double odds) {
        if (bankroll.signum() <= 0 || odds <= 0) {
            return BigDecimal.ZERO;
        }
        RiskProfile profile = getRiskProfile(bankroll, winRate);

        double p = (ev + 1) / odds;
        double kelly = (p * odds - (1 - p)) / odds;
        if (kelly <= 0) {
            log.debug("Non-positive Kelly {} for ev={} odds={}, not sizing", kelly, ev, odds);
            return BigDecimal.ZERO;
        }

        double fraction = Math.min(kelly * profile.getKellyMultiplier(), profile.getMaxPositionPct());
        BigDecimal raw = bankroll.multiply(BigDecimal.valueOf(fraction));
        BigDecimal cap = bankroll.multiply(BigDecimal.valueOf(profile.getMaxPositionPct()));
        raw = raw.min(cap);

        if (raw.compareTo(riskSizingConfig.getMinTradeDollars()) < 0) {
            log.debug("Size ${} under minimum ${} ({}), skipping",
                    raw.setScale(2, RoundingMode.DOWN), riskSizingConfig.getMinTradeDollars(), profile.getLevel());
            return BigDecimal.ZERO;
        }

        BigDecimal size = raw.compareTo(FINE_ROUNDING_LIMIT) < 0
                ? raw.setScale(1, RoundingMode.DOWN)
                : raw.setScale(0, RoundingMode.DOWN);
        log.debug("Sized ${} ({} profile, kelly={}, fraction={})",
                size, profile.getLevel().getLabel(), kelly, fraction);
        return size;
    }

    // ========================
    // CIRCUIT BREAKER
    // ========================

    public boolean canTrade(BigDecimal bankroll) {
        return canTrade(bankroll, Universe.REAL);
    }

    /**
     * False when today's realized loss in {@code universe} has reached the daily loss limit, or
     * the bankroll has drawn down below the drawdown floor.
     */
    public boolean canTrade(BigDecimal bankroll, Universe universe) {
        BigDecimal initial = riskSizingConfig.getInitialBankroll();
        BigDecimal lossLimit = initial.multiply(BigDecimal.valueOf(riskSizingConfig.getDailyLossLimit()));
        BigDecimal loss = dailyLoss.get(universe).get();
        if (loss.compareTo(lossLimit) >= 0) {
            log.warn("Daily loss limit reached for {}: ${} >= ${}", universe, loss, lossLimit);
            return false;
        }
        BigDecimal floor = initial.multiply(BigDecimal.valueOf(riskSizingConfig.getDrawdownFloor()));
        if (bankroll.compareTo(floor) < 0) {
            log.warn("Bankroll ${} below drawdown floor ${}, trading halted", bankroll, floor);
            return false;
        }
        return true;
    }

    /** Records a realized trade result against the live universe. */
    public void recordResult(BigDecimal profit) {
        recordResult(profit, Universe.REAL);
    }

    public synchronized void recordResult(BigDecimal profit, Universe universe) {
        if (profit.signum() > 0) {
            consecutiveWins++;
            consecutiveLosses = 0;
        } else if (profit.signum() < 0) {
            consecutiveLosses++;
            consecutiveWins = 0;
            dailyLoss.get(universe).updateAndGet(current -> current.add(profit.abs()));
        }
        log.debug("Recorded {} result ${}: wins={} losses={} dailyLoss=${}",
                universe, profit, consecutiveWins, consecutiveLosses, dailyLoss.get(universe).get());
    }

    @EventListener
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.CLOSED && event.getPosition().getPnl() != null) {
            recordResult(event.getPosition().getPnl(), event.getUniverse());
        }
    }

    /** Clears the daily loss tally. Runs at local midnight. */
    @Scheduled(cron = "${agent.risk.daily-reset-cron:0 0 0 * * *}")
    public synchronized void resetDailyStats() {
        dailyLoss.values().forEach(loss -> loss.set(BigDecimal.ZERO));
        log.info("Daily risk stats reset");
    }

    public BigDecimal getDailyLoss(Universe universe) {
        return dailyLoss.get(universe).get();
    }

    public synchronized int getConsecutiveWins() {
        return consecutiveWins;
    }

    public synchronized int getConsecutiveLosses() {
        return consecutiveLosses;
    }

    private static RiskProfile profile(RiskLevel level, double maxPositionPct, double minEv, double kellyMultiplier) {
        return RiskProfile.builder()
                .level(level)
                .maxPositionPct(maxPositionPct)
                .minEvThreshold(minEv)
                .kellyMultiplier(kellyMultiplier)
                .build();
    }
}
