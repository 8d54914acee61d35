package com.gridbot.application.usecase;

import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.order.Order;
import com.gridbot.domain.order.Side;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.domain.signal.Decision;
import com.gridbot.domain.signal.TradeAction;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds limit orders for actionable decisions.
 *
 * <ul>
 *   <li>BUY: limit {@code price * (1 + slippage)}, quantity {@code notional / (limit * (1 + fee))}.</li>
 *   <li>SELL: limit {@code price * (1 - slippage)}, quantity {@code min(notional / limit, held)}.</li>
 * </ul>
 * Prices are rounded half-up to {@code priceScale}, quantities down to {@code qtyScale}.
 */
public final class OrderSizer {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final BigDecimal feeRate;
    private final BigDecimal slippageRate;
    private final int priceScale;
    private final int qtyScale;

    public OrderSizer(BigDecimal feeRate, BigDecimal slippageRate, int priceScale, int qtyScale) {
        this.feeRate = Objects.requireNonNull(feeRate, "feeRate");
        this.slippageRate = Objects.requireNonNull(slippageRate, "slippageRate");
        if (feeRate.signum() < 0) throw new IllegalArgumentException("feeRate must be >= 0");
        if (slippageRate.signum() < 0 || slippageRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("slippageRate must be in [0, 1)");
        }
        if (priceScale < 0 || qtyScale < 0) throw new IllegalArgumentException("scales must be >= 0");
        this.priceScale = priceScale;
        this.qtyScale = qtyScale;
    }

    /**
     * @return empty for HOLD, for a SELL without an open position and when rounding leaves nothing
     */
    public Optional<Order> size(MarketSymbol symbol, Decision decision, BigDecimal notional, Position position) {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(notional, "notional");
        BigDecimal price = decision.price();

        if (decision.action() == TradeAction.BUY) {
            BigDecimal limit = price.multiply(BigDecimal.ONE.add(slippageRate)).setScale(priceScale, RoundingMode.HALF_UP);
            BigDecimal perUnit = limit.multiply(BigDecimal.ONE.add(feeRate));
            BigDecimal qty = notional.divide(perUnit, MC).setScale(qtyScale, RoundingMode.DOWN);
            return qty.signum() > 0 ? Optional.of(Order.limit(symbol, Side.BUY, qty, limit)) : Optional.empty();
        }

        if (decision.action() == TradeAction.SELL) {
            if (position == null || !position.isOpen()) return Optional.empty();
            BigDecimal limit = price.multiply(BigDecimal.ONE.subtract(slippageRate)).setScale(priceScale, RoundingMode.HALF_UP);
            if (limit.signum() <= 0) return Optional.empty();
            BigDecimal qty = notional.divide(limit, MC).min(position.quantity()).setScale(qtyScale, RoundingMode.DOWN);
            return qty.signum() > 0 ? Optional.of(Order.limit(symbol, Side.SELL, qty, limit)) : Optional.empty();
        }

        return Optional.empty();
    }

    public BigDecimal feeRate() {
        return feeRate;
    }
}
