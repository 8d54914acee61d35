package com.gridbot.domain.signal;

import com.gridbot.domain.grid.GridConfig;
import com.gridbot.domain.grid.GridLadder;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Grid decision with a minimum-move filter.
 *
 * <ol>
 *   <li>Before the first trade: BUY when the price is in or below the lowest band, otherwise HOLD.</li>
 *   <li>After that: HOLD while {@code |p - lastTradePrice| / lastTradePrice < minMovePct}.</li>
 *   <li>Otherwise BUY when the price fell to a lower band than the last trade's band, SELL when it
 *       rose to a higher one, HOLD when the band is unchanged.</li>
 * </ol>
 *
 * <p>{@link #decide} never mutates anything. The caller replaces the {@link HysteresisState} only once
 * the resulting order is FILLED.
 */
public final class HysteresisSignal {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final GridConfig grid;
    private final BigDecimal minMovePct;

    /**
     * @param minMovePct minimum fractional move from the last trade price (0.01 = 1%)
     */
    public HysteresisSignal(GridConfig grid, BigDecimal minMovePct) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.minMovePct = Objects.requireNonNull(minMovePct, "minMovePct");
        if (minMovePct.signum() < 0) {
            throw new IllegalArgumentException("minMovePct must be >= 0, got " + minMovePct);
        }
    }

    public GridConfig grid() { return grid; }

    public BigDecimal minMovePct() { return minMovePct; }

    public Decision decide(HysteresisState state, BigDecimal price) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(price, "price");

        int newBand = GridLadder.bandOf(price, grid);

        if (!state.hasTraded()) {
            if (newBand <= 0) {
                return new Decision(TradeAction.BUY, price, newBand, null,
                        "first entry at band " + newBand);
            }
            return new Decision(TradeAction.HOLD, price, newBand, null,
                    "no trade yet, waiting for lowest band (band=" + newBand + ")");
        }

        BigDecimal last = state.lastTradePrice();
        BigDecimal movePct = price.subtract(last).abs().divide(last, MC);
        if (movePct.compareTo(minMovePct) < 0) {
            return new Decision(TradeAction.HOLD, price, newBand, movePct,
                    "move " + movePct + " < min " + minMovePct);
        }

        int currentBand = state.currentBand();
        if (newBand < currentBand) {
            return new Decision(TradeAction.BUY, price, newBand, movePct,
                    "band " + currentBand + " -> " + newBand);
        }
        if (newBand > currentBand) {
            return new Decision(TradeAction.SELL, price, newBand, movePct,
                    "band " + currentBand + " -> " + newBand);
        }
        return new Decision(TradeAction.HOLD, price, newBand, movePct, "band unchanged " + newBand);
    }
}
