package com.gridbot.application.paper;

import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.Side;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Turns an order into a simulated fill.
 *
 * <p>Limit orders fill completely at their limit price. Market orders fill at the last price moved by
 * the slippage rate against the trader. The fee is charged in quote currency on the fill notional.
 */
public final class PaperExecutionModel {

    /** Fee rate in decimals (e.g. 0.0025 = 0.25%). */
    private final BigDecimal feeRate;
    /** Slippage for market orders in decimals (e.g. 0.0008 = 8 bps). */
    private final BigDecimal slippageRate;

    public PaperExecutionModel(BigDecimal feeRate, BigDecimal slippageRate) {
        this.feeRate = Objects.requireNonNull(feeRate, "feeRate");
        this.slippageRate = Objects.requireNonNull(slippageRate, "slippageRate");
        if (feeRate.signum() < 0) throw new IllegalArgumentException("feeRate must be >= 0");
        if (slippageRate.signum() < 0) throw new IllegalArgumentException("slippageRate must be >= 0");
    }

    public BigDecimal feeRate() { return feeRate; }

    public BigDecimal slippageRate() { return slippageRate; }

    public PaperFill fill(Order order, BigDecimal lastPrice) {
        Objects.requireNonNull(order, "order");
        BigDecimal price;
        if (!order.isMarket()) {
            price = order.limitPrice();
        } else {
            Objects.requireNonNull(lastPrice, "lastPrice");
            BigDecimal factor = order.side() == Side.BUY
                    ? BigDecimal.ONE.add(slippageRate)
                    : BigDecimal.ONE.subtract(slippageRate);
            price = lastPrice.multiply(factor);
        }
        BigDecimal notional = order.quantity().multiply(price);
        BigDecimal fee = notional.multiply(feeRate);
        return new PaperFill(order.side(), order.quantity(), price, notional, fee);
    }

    public record PaperFill(Side side, BigDecimal quantity, BigDecimal price, BigDecimal notional, BigDecimal fee) {
    }
}
