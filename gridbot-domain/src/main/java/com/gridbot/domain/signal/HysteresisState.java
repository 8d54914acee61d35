package com.gridbot.domain.signal;

import java.math.BigDecimal;

/**
 * Price and grid band of the last executed trade for one symbol.
 *
 * <p>Both fields are null until the first fill. A new value replaces the old one only after an
 * order derived from a decision is confirmed FILLED.
 */
public record HysteresisState(BigDecimal lastTradePrice, Integer currentBand) {

    public HysteresisState {
        if (lastTradePrice != null && lastTradePrice.signum() <= 0) {
            throw new IllegalArgumentException("lastTradePrice must be > 0: " + lastTradePrice);
        }
    }

    public static HysteresisState initial() {
        return new HysteresisState(null, null);
    }

    public boolean hasTraded() {
        return lastTradePrice != null && currentBand != null;
    }

    /** State after a fill of {@code decision}. */
    public static HysteresisState afterFill(Decision decision) {
        return new HysteresisState(decision.price(), decision.newBand());
    }
}
