package com.gridbot.domain.signal;

public enum TradeAction {
    BUY,
    SELL,
    HOLD
}
