package com.gridbot.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Last traded price of a symbol as observed on the exchange.
 */
public record PriceTick(MarketSymbol symbol, BigDecimal price, Instant timestamp) {

    public PriceTick {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(timestamp, "timestamp");
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("price must be > 0: " + price);
        }
    }

    /**
     * True when this tick is strictly older than {@code other}. A tick with the same timestamp is not
     * older: the exchange reports the same last trade until a new one prints.
     */
    public boolean isOlderThan(PriceTick other) {
        return other != null && timestamp.isBefore(other.timestamp);
    }
}
