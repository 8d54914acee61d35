package com.gridbot.application.engine;

import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.portfolio.Position;

import java.math.BigDecimal;

/**
 * Summary of one backtest run. {@code equity} values the remaining base at the last close.
 */
public record BacktestReport(MarketSymbol symbol,
                             int candles,
                             int buys,
                             int sells,
                             int skipped,
                             Position finalPosition,
                             BigDecimal lastPrice,
                             BigDecimal startQuote,
                             BigDecimal endQuote,
                             BigDecimal equity,
                             boolean halted) {

    public int trades() {
        return buys + sells;
    }

    public BigDecimal realizedPnl() {
        return finalPosition.realizedPnl();
    }

    public BigDecimal unrealizedPnl() {
        return lastPrice == null ? BigDecimal.ZERO : finalPosition.unrealizedPnl(lastPrice);
    }

    /** Equity change net of fees. */
    public BigDecimal netPnl() {
        return equity.subtract(startQuote);
    }
}
