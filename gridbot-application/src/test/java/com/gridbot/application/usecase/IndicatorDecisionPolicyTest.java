package com.gridbot.application.usecase;

import com.gridbot.domain.grid.GridConfig;
import com.gridbot.domain.market.Candle;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.signal.Decision;
import com.gridbot.domain.signal.HysteresisState;
import com.gridbot.domain.signal.IndicatorSignal;
import com.gridbot.domain.signal.SignalValue;
import com.gridbot.domain.signal.TradeAction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IndicatorDecisionPolicyTest {

    private static final MarketSymbol XRP = MarketSymbol.parse("XRP_THB");
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final GridConfig grid = GridConfig.ofLineCount(new BigDecimal("90"), new BigDecimal("110"), 3, new BigDecimal("100"));

    @Test
    void aggregatesTicksIntoCandlesAndWaitsForWarmUp() {
        List<List<Candle>> seen = new ArrayList<>();
        IndicatorSignal lastCloseBelow95 = (candles, params) -> {
            seen.add(candles);
            Candle last = candles.get(candles.size() - 1);
            return last.close() < params.get("threshold")
                    ? new SignalValue(TradeAction.BUY, Map.of("close", last.close()))
                    : SignalValue.hold();
        };
        IndicatorDecisionPolicy policy = new IndicatorDecisionPolicy(grid, lastCloseBelow95,
                Map.of("threshold", 95.0), Duration.ofMinutes(1), 10, 2);

        Decision warmUp = policy.decide(HysteresisState.initial(), tick("100", 0));
        assertThat(warmUp.action()).isEqualTo(TradeAction.HOLD);
        assertThat(seen).isEmpty();

        policy.decide(HysteresisState.initial(), tick("102", 20));
        Decision buy = policy.decide(HysteresisState.initial(), tick("94", 70));

        assertThat(buy.action()).isEqualTo(TradeAction.BUY);
        assertThat(buy.newBand()).isEqualTo(0);
        List<Candle> series = seen.get(seen.size() - 1);
        assertThat(series).hasSize(2);
        assertThat(series.get(0).open()).isEqualTo(100.0);
        assertThat(series.get(0).high()).isEqualTo(102.0);
        assertThat(series.get(0).close()).isEqualTo(102.0);
        assertThat(series.get(1).close()).isEqualTo(94.0);
    }

    @Test
    void keepsAtMostLookbackCandles() {
        List<Integer> sizes = new ArrayList<>();
        IndicatorDecisionPolicy policy = new IndicatorDecisionPolicy(grid,
                (candles, params) -> {
                    sizes.add(candles.size());
                    return SignalValue.hold();
                },
                Map.of(), Duration.ofMinutes(1), 3, 1);

        for (int i = 0; i < 10; i++) {
            policy.decide(HysteresisState.initial(), tick("100", i * 60L));
        }

        assertThat(sizes).endsWith(3, 3, 3);
        assertThat(sizes).allMatch(n -> n <= 3);
    }

    private static PriceTick tick(String px, long secondsAfterStart) {
        return new PriceTick(XRP, new BigDecimal(px), T0.plusSeconds(secondsAfterStart));
    }
}
