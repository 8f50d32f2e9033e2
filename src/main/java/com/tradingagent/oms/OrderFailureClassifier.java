package com.tradingagent.oms;

import com.tradingagent.domain.enums.OrderRejectReason;
import com.tradingagent.exchange.model.OrderResult;
import org.springframework.stereotype.Component;

/**
 * Maps an exchange reply onto {@link OrderOutcome.Kind}. Only a missing or closed market is
 * transient: in time-boxed markets that means the window rolled between signal and order.
 */
@Component
public class OrderFailureClassifier {

    public OrderOutcome.Kind classify(OrderResult result) {
        if (result.isSuccess()) {
            return OrderOutcome.Kind.SUCCESS;
        }
        return isTransient(result.getRejectReason()) ? OrderOutcome.Kind.TRANSIENT : OrderOutcome.Kind.PERMANENT;
    }

    public boolean isTransient(OrderRejectReason reason) {
        return reason == OrderRejectReason.MARKET_NOT_FOUND || reason == OrderRejectReason.MARKET_CLOSED;
    }
}
