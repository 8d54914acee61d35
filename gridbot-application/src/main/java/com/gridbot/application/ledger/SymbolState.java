package com.gridbot.application.ledger;

import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.domain.signal.HysteresisState;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything persisted for one symbol: the position, the hysteresis state of the last trade, the
 * idempotency tokens of the most recently applied fills and the order still awaiting its outcome,
 * if any.
 */
public record SymbolState(MarketSymbol symbol,
                          Position position,
                          HysteresisState hysteresis,
                          List<String> appliedTokens,
                          OpenOrder openOrder,
                          Instant updatedAt) {

    public SymbolState {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(position, "position");
        hysteresis = hysteresis == null ? HysteresisState.initial() : hysteresis;
        appliedTokens = appliedTokens == null ? List.of() : List.copyOf(appliedTokens);
        if (!symbol.equals(position.symbol())) {
            throw new IllegalArgumentException("Position of " + position.symbol() + " stored under " + symbol);
        }
    }

    public SymbolState(MarketSymbol symbol,
                       Position position,
                       HysteresisState hysteresis,
                       List<String> appliedTokens,
                       Instant updatedAt) {
        this(symbol, position, hysteresis, appliedTokens, null, updatedAt);
    }

    public static SymbolState fresh(MarketSymbol symbol) {
        return new SymbolState(symbol, Position.flat(symbol), HysteresisState.initial(), List.of(), null, null);
    }

    public SymbolState withOpenOrder(OpenOrder order, Instant at) {
        return new SymbolState(symbol, position, hysteresis, appliedTokens, order, at);
    }

    public boolean hasApplied(String token) {
        return token != null && appliedTokens.contains(token);
    }
}
