package com.tradingagent.api.controller;

import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.QueuedTrade;
import com.tradingagent.domain.model.RiskProfile;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.oms.RetryQueue;
import com.tradingagent.risk.BankrollService;
import com.tradingagent.risk.ExposureTracker;
import com.tradingagent.risk.RiskSizer;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only risk state: current profile, circuit breaker, exposure and the retry backlog. */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private final RiskSizer riskSizer;
    private final BankrollService bankrollService;
    private final ExposureTracker exposureTracker;
    private final PositionLedger positionLedger;
    private final RetryQueue retryQueue;

    public RiskController(
            RiskSizer riskSizer,
            BankrollService bankrollService,
            ExposureTracker exposureTracker,
            PositionLedger positionLedger,
            RetryQueue retryQueue) {
        this.riskSizer = riskSizer;
        this.bankrollService = bankrollService;
        this.exposureTracker = exposureTracker;
        this.positionLedger = positionLedger;
        this.retryQueue = retryQueue;
    }

    @GetMapping("/profile")
    public ResponseEntity<Map<String, Object>> getProfile(@RequestParam(defaultValue = "REAL") Universe universe) {
        BigDecimal bankroll = bankrollService.currentBankroll(universe);
        double winRate = positionLedger.getPerformance(null, universe).getWinRate();
        RiskProfile profile = riskSizer.getRiskProfile(bankroll, winRate);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("universe", universe);
        body.put("bankroll", bankroll);
        body.put("winRate", winRate);
        body.put("profile", profile);
        body.put("canTrade", riskSizer.canTrade(bankroll, universe));
        body.put("dailyLoss", riskSizer.getDailyLoss(universe));
        body.put("exposure", exposureTracker.getExposure(universe));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/retry-queue")
    public ResponseEntity<List<QueuedTrade>> getRetryQueue() {
        return ResponseEntity.ok(retryQueue.snapshot());
    }
}
