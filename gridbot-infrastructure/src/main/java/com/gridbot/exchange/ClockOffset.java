package com.gridbot.exchange;

import com.gridbot.application.exchange.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cached {@code serverTime - localTime}. Signed requests are stamped with {@code localTime + offset}.
 *
 * The offset is refreshed lazily once it is older than {@code maxAge}, and eagerly via
 * {@link #refresh()} after the exchange rejects a timestamp or signature.
 */
public final class ClockOffset {

    private static final Logger log = LoggerFactory.getLogger(ClockOffset.class);

    @FunctionalInterface
    public interface ServerTime {
        long fetch() throws ExchangeException;
    }

    private final ServerTime serverTime;
    private final Clock clock;
    private final Duration maxAge;

    private volatile long offsetMs;
    private volatile Instant syncedAt;

    public ClockOffset(ServerTime serverTime, Clock clock, Duration maxAge) {
        this.serverTime = Objects.requireNonNull(serverTime, "serverTime");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
    }

    /** Exchange-aligned timestamp for the next signed request. */
    public long timestampMs() throws ExchangeException {
        if (isStale()) {
            refresh();
        }
        return clock.millis() + offsetMs;
    }

    public synchronized long refresh() throws ExchangeException {
        long before = clock.millis();
        long server = serverTime.fetch();
        long after = clock.millis();
        offsetMs = server - (before + after) / 2;
        syncedAt = clock.instant();
        log.info("[SYNC] Server time synced, offset={} ms", offsetMs);
        return offsetMs;
    }

    public boolean isStale() {
        Instant at = syncedAt;
        return at == null || !clock.instant().isBefore(at.plus(maxAge));
    }

    public long offsetMs() {
        return offsetMs;
    }
}
