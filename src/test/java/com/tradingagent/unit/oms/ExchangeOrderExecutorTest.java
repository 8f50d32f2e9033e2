package com.tradingagent.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradingagent.domain.enums.OrderRejectReason;
import com.tradingagent.domain.enums.Side;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.QueuedTrade;
import com.tradingagent.exception.ExchangeException;
import com.tradingagent.exchange.ExchangeGateway;
import com.tradingagent.exchange.TickerResolver;
import com.tradingagent.exchange.model.OrderResult;
import com.tradingagent.oms.ExchangeOrderExecutor;
import com.tradingagent.oms.OrderFailureClassifier;
import com.tradingagent.oms.OrderOutcome;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExchangeOrderExecutorTest {

    private ExchangeGateway exchangeGateway;
    private TickerResolver tickerResolver;
    private ExchangeOrderExecutor executor;

    @BeforeEach
    void setUp() {
        exchangeGateway = mock(ExchangeGateway.class);
        tickerResolver = mock(TickerResolver.class);
        executor = new ExchangeOrderExecutor(exchangeGateway, tickerResolver, new OrderFailureClassifier());
    }

    private static QueuedTrade trade() {
        return QueuedTrade.builder()
                .tickerSelector("KXETH15M")
                .side(Side.NO)
                .priceCents(55)
                .contracts(3)
                .universe(Universe.REAL)
                .build();
    }

    @Test
    @DisplayName("Resolved ticker is written back and the order is placed on it")
    void placesOnResolvedTicker() {
        QueuedTrade trade = trade();
        when(tickerResolver.resolve("KXETH15M")).thenReturn(Optional.of("KXETH15M-1015"));
        when(exchangeGateway.placeOrder("KXETH15M-1015", Side.NO, 55, 3)).thenReturn(OrderResult.accepted("o-1"));

        OrderOutcome outcome = executor.execute(trade);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getTicker()).isEqualTo("KXETH15M-1015");
        assertThat(trade.getTicker()).isEqualTo("KXETH15M-1015");
    }

    @Test
    @DisplayName("No open market for the selector is transient")
    void unresolvedIsTransient() {
        when(tickerResolver.resolve("KXETH15M")).thenReturn(Optional.empty());

        OrderOutcome outcome = executor.execute(trade());

        assertThat(outcome.getKind()).isEqualTo(OrderOutcome.Kind.TRANSIENT);
        verify(exchangeGateway, never()).placeOrder(any(), any(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Market closed rejection is transient, insufficient funds is permanent")
    void classifiesRejections() {
        when(tickerResolver.resolve("KXETH15M")).thenReturn(Optional.of("KXETH15M-1015"));
        when(exchangeGateway.placeOrder(any(), any(), anyInt(), anyInt()))
                .thenReturn(OrderResult.rejected(OrderRejectReason.MARKET_CLOSED, "closed", 400))
                .thenReturn(OrderResult.rejected(OrderRejectReason.INSUFFICIENT_FUNDS, "funds", 400));

        assertThat(executor.execute(trade()).getKind()).isEqualTo(OrderOutcome.Kind.TRANSIENT);
        assertThat(executor.execute(trade()).getKind()).isEqualTo(OrderOutcome.Kind.PERMANENT);
    }

    @Test
    @DisplayName("Transport failure during placement is permanent")
    void transportFailureIsPermanent() {
        when(tickerResolver.resolve("KXETH15M")).thenReturn(Optional.of("KXETH15M-1015"));
        when(exchangeGateway.placeOrder(any(), any(), anyInt(), anyInt())).thenThrow(new ExchangeException("timeout"));

        OrderOutcome outcome = executor.execute(trade());

        assertThat(outcome.getKind()).isEqualTo(OrderOutcome.Kind.PERMANENT);
        assertThat(outcome.getMessage()).isEqualTo("timeout");
    }

    @Test
    @DisplayName("Failure to list markets is permanent")
    void resolverFailureIsPermanent() {
        when(tickerResolver.resolve("KXETH15M")).thenThrow(new ExchangeException("unreachable"));

        assertThat(executor.execute(trade()).getKind()).isEqualTo(OrderOutcome.Kind.PERMANENT);
    }
}
