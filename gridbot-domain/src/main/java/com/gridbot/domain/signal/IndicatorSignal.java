package com.gridbot.domain.signal;

import com.gridbot.domain.market.Candle;

import java.util.List;
import java.util.Map;

/**
 * Pluggable indicator strategy (MACD, RSI, EMA cross, Z-score, ...).
 *
 * <p>Implementations must be pure: the same candles and params always give the same value.
 */
@FunctionalInterface
public interface IndicatorSignal {

    SignalValue compute(List<Candle> candles, Map<String, Double> params);
}
