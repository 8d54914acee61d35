package com.gridbot.domain.order;

public enum Side {
    BUY,
    SELL
}
