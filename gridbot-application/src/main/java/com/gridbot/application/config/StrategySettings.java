package com.gridbot.application.config;

import com.gridbot.application.ports.ConfigPort;
import com.gridbot.domain.signal.IndicatorSignal;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Which decision policy drives the trade loops.
 *
 * <p>{@code strategyType=grid} (default) trades the hysteresis grid. {@code strategyType=indicator}
 * feeds candles built from ticks into the {@link IndicatorSignal} named by
 * {@code strategy.indicatorClass}, with parameters from {@code strategy.params}
 * ({@code fast:12,slow:26}).
 */
public record StrategySettings(Type type,
                               String indicatorClass,
                               Duration candlePeriod,
                               int lookback,
                               int minCandles,
                               Map<String, Double> params) {

    public enum Type { GRID, INDICATOR }

    public StrategySettings {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(candlePeriod, "candlePeriod");
        params = params == null ? Map.of() : Map.copyOf(params);
        if (type == Type.INDICATOR && (indicatorClass == null || indicatorClass.isBlank())) {
            throw new IllegalArgumentException(ConfigKey.STRATEGY_INDICATOR_CLASS.key() + " is required for strategyType=indicator");
        }
    }

    public static StrategySettings grid() {
        return new StrategySettings(Type.GRID, null, Duration.ofMinutes(1), 100, 1, Map.of());
    }

    public static StrategySettings from(ConfigPort c) {
        String raw = c.get(ConfigKey.STRATEGY_TYPE.key(), "grid").trim().toUpperCase(Locale.ROOT);
        Type type;
        try {
            type = Type.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + ConfigKey.STRATEGY_TYPE.key() + ": " + raw.toLowerCase(Locale.ROOT), e);
        }
        if (type == Type.GRID) return grid();

        String cls = c.get(ConfigKey.STRATEGY_INDICATOR_CLASS.key(), null);
        return new StrategySettings(type,
                cls == null ? null : cls.trim(),
                Duration.ofSeconds(c.getInt(ConfigKey.STRATEGY_CANDLE_SEC.key(), 60)),
                c.getInt(ConfigKey.STRATEGY_LOOKBACK.key(), 100),
                c.getInt(ConfigKey.STRATEGY_MIN_CANDLES.key(), 26),
                parseParams(c.get(ConfigKey.STRATEGY_PARAMS.key(), "")));
    }

    /**
     * Instantiates the configured indicator through its public no-arg constructor.
     *
     * @throws IllegalArgumentException when the class is missing, is not an {@link IndicatorSignal}
     *                                  or cannot be created
     */
    public IndicatorSignal newIndicator() {
        try {
            Class<?> cls = Class.forName(indicatorClass);
            if (!IndicatorSignal.class.isAssignableFrom(cls)) {
                throw new IllegalArgumentException(indicatorClass + " does not implement IndicatorSignal");
            }
            return (IndicatorSignal) cls.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot create indicator " + indicatorClass + ": " + e, e);
        }
    }

    static Map<String, Double> parseParams(String raw) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) return out;
        for (String pair : raw.split(",")) {
            if (pair.isBlank()) continue;
            int sep = pair.indexOf(':');
            if (sep <= 0) throw new IllegalArgumentException("strategy.params entry must be name:value, got '" + pair.trim() + "'");
            out.put(pair.substring(0, sep).trim(), Double.parseDouble(pair.substring(sep + 1).trim()));
        }
        return out;
    }
}
