package com.gridbot.application.config;

import com.gridbot.domain.grid.GridConfig;
import com.gridbot.domain.market.MarketSymbol;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Grid and hysteresis settings of one traded symbol.
 *
 * @param minMovePct fractional minimum move from the last trade price (0.007 = 0.7%)
 */
public record SymbolSettings(MarketSymbol symbol, GridConfig grid, BigDecimal minMovePct) {

    public SymbolSettings {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(minMovePct, "minMovePct");
    }
}
