package com.tradingagent.exchange.model;

import com.tradingagent.domain.enums.OrderRejectReason;
import lombok.Builder;
import lombok.Value;

/** Exchange reply to an order placement. Exactly one of orderId / rejectReason is set. */
@Value
@Builder
public class OrderResult {

    boolean success;
    String orderId;
    OrderRejectReason rejectReason;
    String error;
    Integer statusCode;

    public static OrderResult accepted(String orderId) {
        return OrderResult.builder().success(true).orderId(orderId).build();
    }

    public static OrderResult rejected(OrderRejectReason reason, String error, Integer statusCode) {
        return OrderResult.builder()
                .success(false)
                .rejectReason(reason)
                .error(error)
                .statusCode(statusCode)
                .build();
    }
}
