package com.gridbot.domain.signal;

import java.util.Map;

/**
 * Output of an indicator collaborator: a suggested action plus named indicator values
 * (e.g. {@code macd}, {@code signal}, {@code rsi}) for logging.
 */
public record SignalValue(TradeAction action, Map<String, Double> values) {

    public SignalValue {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static SignalValue hold() {
        return new SignalValue(TradeAction.HOLD, Map.of());
    }
}
