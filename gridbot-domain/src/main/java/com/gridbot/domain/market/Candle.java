package com.gridbot.domain.market;

/** Candle (OHLCV) with close time, used by backtests and indicator collaborators. */
public record Candle(
        long openTime,
        double open,
        double high,
        double low,
        double close,
        double volume,
        long closeTime
) {
}
