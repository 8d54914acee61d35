package com.gridbot.application.usecase;

import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.signal.TradeAction;

public record CycleResult(MarketSymbol symbol, CycleOutcome outcome, TradeAction action, String message) {

    static CycleResult of(MarketSymbol symbol, CycleOutcome outcome, String message) {
        return new CycleResult(symbol, outcome, TradeAction.HOLD, message);
    }
}
