package com.gridbot.domain.order;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Final outcome of an order submission as reported by the exchange.
 *
 * <p>A partially filled order whose remainder was cancelled is reported {@link OrderStatus#FILLED}
 * with the quantity that actually filled.
 *
 * @param orderId      exchange order id, null when the exchange never acknowledged the order
 * @param filledQty    base quantity filled (zero unless FILLED)
 * @param avgPrice     average fill price, null unless FILLED
 * @param fee          quote fee charged for the fill
 */
public record OrderResult(OrderStatus status,
                          String clientId,
                          String orderId,
                          BigDecimal filledQty,
                          BigDecimal avgPrice,
                          BigDecimal fee,
                          String message) {

    public OrderResult {
        Objects.requireNonNull(status, "status");
        filledQty = filledQty == null ? BigDecimal.ZERO : filledQty;
        fee = fee == null ? BigDecimal.ZERO : fee;
        if (status == OrderStatus.FILLED) {
            if (filledQty.signum() <= 0) throw new IllegalArgumentException("FILLED result needs filledQty > 0");
            Objects.requireNonNull(avgPrice, "avgPrice");
        }
    }

    public static OrderResult filled(String clientId, String orderId, BigDecimal qty, BigDecimal price, BigDecimal fee) {
        return new OrderResult(OrderStatus.FILLED, clientId, orderId, qty, price, fee, "filled");
    }

    public static OrderResult rejected(String clientId, String message) {
        return new OrderResult(OrderStatus.REJECTED, clientId, null, BigDecimal.ZERO, null, BigDecimal.ZERO, message);
    }

    public static OrderResult cancelled(String clientId, String orderId, String message) {
        return new OrderResult(OrderStatus.CANCELLED, clientId, orderId, BigDecimal.ZERO, null, BigDecimal.ZERO, message);
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }
}
