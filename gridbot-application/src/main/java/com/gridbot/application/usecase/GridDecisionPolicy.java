package com.gridbot.application.usecase;

import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.signal.Decision;
import com.gridbot.domain.signal.HysteresisSignal;
import com.gridbot.domain.signal.HysteresisState;

import java.util.Objects;

/** Default policy: pure grid hysteresis. */
public final class GridDecisionPolicy implements DecisionPolicy {

    private final HysteresisSignal signal;

    public GridDecisionPolicy(HysteresisSignal signal) {
        this.signal = Objects.requireNonNull(signal, "signal");
    }

    @Override
    public Decision decide(HysteresisState state, PriceTick tick) {
        return signal.decide(state, tick.price());
    }
}
