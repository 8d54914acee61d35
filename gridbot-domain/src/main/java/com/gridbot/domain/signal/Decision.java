package com.gridbot.domain.signal;

import java.math.BigDecimal;

/**
 * Outcome of one {@link HysteresisSignal#decide} call.
 *
 * @param movePct fractional move from the last trade price, null before the first trade
 * @param reason  short log-friendly explanation
 */
public record Decision(TradeAction action,
                       BigDecimal price,
                       int newBand,
                       BigDecimal movePct,
                       String reason) {

    public boolean isActionable() {
        return action == TradeAction.BUY || action == TradeAction.SELL;
    }
}
