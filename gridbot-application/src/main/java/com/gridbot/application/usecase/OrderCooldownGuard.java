package com.gridbot.application.usecase;

import com.gridbot.domain.market.MarketSymbol;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Minimum pause between two fills of the same symbol. The clock starts only when a fill is
 * recorded, so rejected or cancelled orders do not delay the next attempt.
 */
public class OrderCooldownGuard {

    private final Map<MarketSymbol, Instant> lastTrade = new ConcurrentHashMap<>();
    private final Duration cooldown;
    private final Clock clock;

    public OrderCooldownGuard(Duration cooldown) {
        this(cooldown, Clock.systemUTC());
    }

    public OrderCooldownGuard(Duration cooldown, Clock clock) {
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (cooldown.isNegative()) throw new IllegalArgumentException("cooldown must be >= 0");
    }

    public boolean isCoolingDown(MarketSymbol symbol) {
        return !remaining(symbol).isZero();
    }

    public Duration remaining(MarketSymbol symbol) {
        Instant prev = lastTrade.get(symbol);
        if (prev == null || cooldown.isZero()) return Duration.ZERO;
        Duration left = Duration.between(clock.instant(), prev.plus(cooldown));
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void markTraded(MarketSymbol symbol) {
        lastTrade.put(symbol, clock.instant());
    }
}
