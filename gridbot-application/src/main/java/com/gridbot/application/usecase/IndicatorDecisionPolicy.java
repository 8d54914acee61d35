package com.gridbot.application.usecase;

import com.gridbot.domain.grid.GridConfig;
import com.gridbot.domain.grid.GridLadder;
import com.gridbot.domain.market.Candle;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.signal.Decision;
import com.gridbot.domain.signal.HysteresisState;
import com.gridbot.domain.signal.IndicatorSignal;
import com.gridbot.domain.signal.SignalValue;
import com.gridbot.domain.signal.TradeAction;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives trades from an {@link IndicatorSignal} instead of the grid hysteresis.
 *
 * <p>Ticks are aggregated into candles of {@code candlePeriod}; the indicator sees the closed candles
 * plus the one being built. Holds until {@code minCandles} candles exist. Keeps per-symbol state, so
 * use one instance per symbol and call it from one thread.
 */
public final class IndicatorDecisionPolicy implements DecisionPolicy {

    private final GridConfig grid;
    private final IndicatorSignal indicator;
    private final Map<String, Double> params;
    private final long periodMs;
    private final int lookback;
    private final int minCandles;

    private final Deque<Candle> closed = new ArrayDeque<>();
    private Candle current;

    public IndicatorDecisionPolicy(GridConfig grid,
                                   IndicatorSignal indicator,
                                   Map<String, Double> params,
                                   Duration candlePeriod,
                                   int lookback,
                                   int minCandles) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.indicator = Objects.requireNonNull(indicator, "indicator");
        this.params = params == null ? Map.of() : Map.copyOf(params);
        this.periodMs = Objects.requireNonNull(candlePeriod, "candlePeriod").toMillis();
        if (periodMs <= 0) throw new IllegalArgumentException("candlePeriod must be > 0");
        if (lookback < 1) throw new IllegalArgumentException("lookback must be >= 1");
        this.lookback = lookback;
        this.minCandles = Math.max(1, minCandles);
    }

    @Override
    public Decision decide(HysteresisState state, PriceTick tick) {
        accumulate(tick);
        int band = GridLadder.bandOf(tick.price(), grid);

        List<Candle> series = new ArrayList<>(closed);
        series.add(current);
        if (series.size() < minCandles) {
            return new Decision(TradeAction.HOLD, tick.price(), band, null,
                    "warming up " + series.size() + "/" + minCandles + " candles");
        }

        SignalValue value = indicator.compute(List.copyOf(series), params);
        TradeAction action = value == null ? TradeAction.HOLD : value.action();
        String reason = value == null ? "no signal" : "indicator " + value.values();
        return new Decision(action, tick.price(), band, null, reason);
    }

    private void accumulate(PriceTick tick) {
        double px = tick.price().doubleValue();
        long ts = tick.timestamp().toEpochMilli();
        long open = ts - Math.floorMod(ts, periodMs);

        if (current != null && current.openTime() == open) {
            current = new Candle(open, current.open(), Math.max(current.high(), px), Math.min(current.low(), px),
                    px, current.volume(), open + periodMs - 1);
            return;
        }
        if (current != null) {
            closed.addLast(current);
            while (closed.size() >= lookback) {
                closed.removeFirst();
            }
        }
        current = new Candle(open, px, px, px, px, 0.0, open + periodMs - 1);
    }
}
