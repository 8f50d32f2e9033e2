package com.tradingagent.oms;

import com.tradingagent.domain.enums.OrderRejectReason;
import lombok.Builder;
import lombok.Value;

/** Result of one order attempt, already classified for retry handling. */
@Value
@Builder
public class OrderOutcome {

    public enum Kind {
        SUCCESS,
        /** The target market was not open; retry later against the then-current window. */
        TRANSIENT,
        /** Any other rejection; never retried. */
        PERMANENT
    }

    Kind kind;
    String ticker;
    String orderId;
    OrderRejectReason rejectReason;
    String message;

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public static OrderOutcome success(String ticker, String orderId) {
        return OrderOutcome.builder().kind(Kind.SUCCESS).ticker(ticker).orderId(orderId).build();
    }

    public static OrderOutcome failure(Kind kind, String ticker, OrderRejectReason reason, String message) {
        return OrderOutcome.builder()
                .kind(kind)
                .ticker(ticker)
                .rejectReason(reason)
                .message(message)
                .build();
    }
}
