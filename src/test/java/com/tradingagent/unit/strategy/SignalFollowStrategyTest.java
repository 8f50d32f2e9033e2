package com.tradingagent.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradingagent.core.engine.AllocationBook;
import com.tradingagent.domain.enums.ExecutionMode;
import com.tradingagent.domain.enums.Side;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.Opportunity;
import com.tradingagent.domain.model.QueuedTrade;
import com.tradingagent.domain.model.TradeSignal;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.oms.SubmissionResult;
import com.tradingagent.oms.TradeSubmitter;
import com.tradingagent.risk.BankrollService;
import com.tradingagent.risk.ExposureTracker;
import com.tradingagent.risk.RiskSizer;
import com.tradingagent.risk.RiskSizingConfig;
import com.tradingagent.strategy.StrategyProperties;
import com.tradingagent.strategy.base.CancellationToken;
import com.tradingagent.strategy.base.StrategyContext;
import com.tradingagent.strategy.feed.SignalChannel;
import com.tradingagent.strategy.impl.SignalFollowStrategy;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SignalFollowStrategyTest {

    private PositionLedger positionLedger;
    private TradeSubmitter tradeSubmitter;
    private SignalChannel signalChannel;
    private SignalFollowStrategy strategy;
    private ExecutorService executor;

    private final List<QueuedTrade> submitted = new CopyOnWriteArrayList<>();
    private CountDownLatch submissions;

    @BeforeEach
    void setUp() {
        positionLedger = mock(PositionLedger.class);
        BankrollService bankrollService = mock(BankrollService.class);
        tradeSubmitter = mock(TradeSubmitter.class);
        signalChannel = new SignalChannel();
        executor = Executors.newSingleThreadExecutor();
        submissions = new CountDownLatch(1);

        when(positionLedger.openNotional(any())).thenReturn(BigDecimal.ZERO);
        when(bankrollService.currentBankroll(Universe.SIMULATED)).thenReturn(new BigDecimal("100"));
        when(tradeSubmitter.submit(any())).thenAnswer(invocation -> {
            submitted.add(invocation.getArgument(0));
            submissions.countDown();
            return SubmissionResult.builder().status(SubmissionResult.Status.OPENED).build();
        });

        RiskSizingConfig riskConfig = new RiskSizingConfig();
        StrategyProperties.SignalFollow settings = new StrategyProperties.SignalFollow();
        settings.setPollInterval(Duration.ofMillis(20));
        settings.setMaxContracts(10);

        StrategyContext context = StrategyContext.builder()
                .positionLedger(positionLedger)
                .riskSizer(new RiskSizer(riskConfig))
                .exposureTracker(new ExposureTracker(riskConfig, positionLedger))
                .bankrollService(bankrollService)
                .tradeSubmitter(tradeSubmitter)
                .allocationBook(new AllocationBook())
                .build();
        strategy = new SignalFollowStrategy(context, signalChannel, settings);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static TradeSignal signal(String selector, int priceCents, int contracts) {
        return TradeSignal.builder()
                .source("whale-1")
                .tickerSelector(selector)
                .side(Side.YES)
                .priceCents(priceCents)
                .contracts(contracts)
                .build();
    }

    @Test
    @DisplayName("Runs continuously")
    void continuousMode() {
        assertThat(strategy.getExecutionMode()).isEqualTo(ExecutionMode.CONTINUOUS);
        assertThat(strategy.getScanInterval()).isEqualTo(Duration.ofMillis(20));
    }

    @Test
    @DisplayName("Copies signals by ticker selector, capped at the maximum contract count")
    void copiesSignalWithCap() throws Exception {
        CancellationToken token = new CancellationToken();
        Future<?> loop = executor.submit(() -> strategy.runContinuously(token));

        signalChannel.publish(signal("KXBTC15M", 50, 50));

        assertThat(submissions.await(5, TimeUnit.SECONDS)).isTrue();
        token.cancel();
        loop.get(5, TimeUnit.SECONDS);

        QueuedTrade trade = submitted.get(0);
        assertThat(trade.getTickerSelector()).isEqualTo("KXBTC15M");
        assertThat(trade.getTicker()).isNull();
        assertThat(trade.getContracts()).isEqualTo(10);
        assertThat(trade.getSource()).isEqualTo("whale-1");
        assertThat(trade.getReservedNotional()).isEqualByComparingTo("5.00");
        verify(tradeSubmitter, atLeastOnce()).drainRetryQueue();
    }

    @Test
    @DisplayName("The cancel hook ends the loop without a token")
    void cancelHookStopsLoop() throws Exception {
        Future<?> loop = executor.submit(() -> strategy.runContinuously(new CancellationToken()));
        verify(tradeSubmitter, timeout(5000).atLeastOnce()).drainRetryQueue();

        strategy.cancel();

        loop.get(5, TimeUnit.SECONDS);
        assertThat(loop.isDone()).isTrue();
    }

    @Test
    @DisplayName("Signals without contracts are ignored")
    void ignoresEmptySignals() {
        signalChannel.publish(signal("KXBTC15M", 50, 0));

        List<Opportunity> found = strategy.scan();

        assertThat(found).isEmpty();
        verify(tradeSubmitter, never()).submit(any());
    }

    @Test
    @DisplayName("Fixed-size signals still respect the circuit breaker")
    void circuitBreakerAppliesToSignals() {
        RiskSizingConfig riskConfig = new RiskSizingConfig();
        BankrollService drained = mock(BankrollService.class);
        when(drained.currentBankroll(Universe.SIMULATED)).thenReturn(new BigDecimal("40"));
        StrategyContext context = StrategyContext.builder()
                .positionLedger(positionLedger)
                .riskSizer(new RiskSizer(riskConfig))
                .exposureTracker(new ExposureTracker(riskConfig, positionLedger))
                .bankrollService(drained)
                .tradeSubmitter(tradeSubmitter)
                .allocationBook(new AllocationBook())
                .build();
        SignalFollowStrategy halted =
                new SignalFollowStrategy(context, signalChannel, new StrategyProperties.SignalFollow());
        signalChannel.publish(signal("KXBTC15M", 50, 5));

        int executed = halted.execute(halted.scan());

        assertThat(executed).isZero();
        verify(tradeSubmitter, never()).submit(any());
    }
}
