package com.gridbot.domain.portfolio;

import com.gridbot.domain.market.MarketSymbol;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Long-only position of one symbol.
 *
 * <p>{@code averageCost} is defined only while {@code quantity > 0}; a full exit resets it to null.
 * Fees are accumulated in {@code feesPaid} and kept out of the average cost and realized P&amp;L.
 */
public record Position(MarketSymbol symbol,
                       BigDecimal quantity,
                       BigDecimal averageCost,
                       BigDecimal realizedPnl,
                       BigDecimal feesPaid) {

    private static final MathContext MC = MathContext.DECIMAL64;

    public Position {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(quantity, "quantity");
        realizedPnl = realizedPnl == null ? BigDecimal.ZERO : realizedPnl;
        feesPaid = feesPaid == null ? BigDecimal.ZERO : feesPaid;
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity must be >= 0, got " + quantity);
        }
        if (quantity.signum() > 0 && averageCost == null) {
            throw new IllegalArgumentException("averageCost is required while quantity > 0");
        }
        if (quantity.signum() == 0 && averageCost != null) {
            throw new IllegalArgumentException("averageCost must be undefined for a flat position");
        }
    }

    public static Position flat(MarketSymbol symbol) {
        return new Position(symbol, BigDecimal.ZERO, null, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public boolean isOpen() {
        return quantity.signum() > 0;
    }

    public Position afterBuy(BigDecimal qty, BigDecimal price, BigDecimal fee) {
        requirePositive(qty, price);
        BigDecimal newQty = quantity.add(qty);
        BigDecimal cost = isOpen() ? averageCost.multiply(quantity) : BigDecimal.ZERO;
        BigDecimal newAvg = cost.add(price.multiply(qty)).divide(newQty, MC);
        return new Position(symbol, newQty, newAvg, realizedPnl, feesPaid.add(nz(fee)));
    }

    /**
     * @throws InsufficientPositionException when {@code qty} exceeds the held quantity
     */
    public Position afterSell(BigDecimal qty, BigDecimal price, BigDecimal fee) {
        requirePositive(qty, price);
        if (qty.compareTo(quantity) > 0) {
            throw new InsufficientPositionException(symbol, quantity, qty);
        }
        BigDecimal pnl = price.subtract(averageCost).multiply(qty);
        BigDecimal newQty = quantity.subtract(qty);
        BigDecimal newAvg = newQty.signum() == 0 ? null : averageCost;
        return new Position(symbol, newQty, newAvg, realizedPnl.add(pnl), feesPaid.add(nz(fee)));
    }

    /** {@code (price - averageCost) * quantity}, zero when flat. */
    public BigDecimal unrealizedPnl(BigDecimal price) {
        if (!isOpen()) return BigDecimal.ZERO;
        return price.subtract(averageCost).multiply(quantity);
    }

    private static void requirePositive(BigDecimal qty, BigDecimal price) {
        Objects.requireNonNull(qty, "qty");
        Objects.requireNonNull(price, "price");
        if (qty.signum() <= 0) throw new IllegalArgumentException("qty must be > 0, got " + qty);
        if (price.signum() <= 0) throw new IllegalArgumentException("price must be > 0, got " + price);
    }

    private static BigDecimal nz(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }
}
