package com.gridbot.domain.portfolio;

import com.gridbot.domain.market.MarketSymbol;

import java.math.BigDecimal;

/**
 * Thrown when a SELL would take the position below zero.
 *
 * <p>The bot never sizes a SELL above the held quantity, so this signals a state-consistency bug and
 * halts the symbol's loop.
 */
public class InsufficientPositionException extends RuntimeException {

    private final MarketSymbol symbol;
    private final BigDecimal held;
    private final BigDecimal requested;

    public InsufficientPositionException(MarketSymbol symbol, BigDecimal held, BigDecimal requested) {
        super("Cannot sell " + requested + " " + symbol.base() + " of " + symbol + ": only " + held + " held");
        this.symbol = symbol;
        this.held = held;
        this.requested = requested;
    }

    public MarketSymbol getSymbol() { return symbol; }

    public BigDecimal getHeld() { return held; }

    public BigDecimal getRequested() { return requested; }
}
