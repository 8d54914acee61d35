package com.gridbot.application.usecase;

import com.gridbot.domain.market.PriceTick;
import com.gridbot.domain.signal.Decision;
import com.gridbot.domain.signal.HysteresisState;

/**
 * Turns the latest tick into a trade decision for one symbol.
 */
public interface DecisionPolicy {

    Decision decide(HysteresisState state, PriceTick tick);
}
