package com.gridbot.exchange;

import com.gridbot.application.config.ConfigKey;
import com.gridbot.application.ports.ConfigPort;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Backoff rules for exchange requests.
 *
 * Delay before retry {@code i} (0-based) = {@code min(maxDelay, baseDelay * multiplier^i) + jitter}.
 * Rate-limit waits are budgeted separately by {@code maxRateLimitWaits} and never consume attempts.
 */
public record RetryPolicy(int maxAttempts,
                          Duration baseDelay,
                          double multiplier,
                          Duration maxDelay,
                          Supplier<Duration> jitter,
                          Duration rateLimitDefault,
                          int maxRateLimitWaits) {

    public static final int DEFAULT_MAX_ATTEMPTS = 4;
    public static final long DEFAULT_BASE_DELAY_MS = 600;
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final long DEFAULT_MAX_DELAY_MS = 10_000;
    public static final long DEFAULT_JITTER_MS = 200;
    public static final long DEFAULT_RATE_LIMIT_MS = 1_000;
    public static final int DEFAULT_MAX_RATE_LIMIT_WAITS = 5;

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(rateLimitDefault, "rateLimitDefault");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        if (maxRateLimitWaits < 0) throw new IllegalArgumentException("maxRateLimitWaits must be >= 0");
        jitter = jitter == null ? () -> Duration.ZERO : jitter;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS,
                Duration.ofMillis(DEFAULT_BASE_DELAY_MS),
                DEFAULT_MULTIPLIER,
                Duration.ofMillis(DEFAULT_MAX_DELAY_MS),
                uniformJitter(DEFAULT_JITTER_MS),
                Duration.ofMillis(DEFAULT_RATE_LIMIT_MS),
                DEFAULT_MAX_RATE_LIMIT_WAITS);
    }

    public static RetryPolicy from(ConfigPort config) {
        Objects.requireNonNull(config, "config");
        return new RetryPolicy(
                config.getInt(ConfigKey.RETRY_MAX_ATTEMPTS.key(), DEFAULT_MAX_ATTEMPTS),
                Duration.ofMillis(config.getInt(ConfigKey.RETRY_BASE_DELAY_MS.key(), (int) DEFAULT_BASE_DELAY_MS)),
                config.getDouble(ConfigKey.RETRY_MULTIPLIER.key(), DEFAULT_MULTIPLIER),
                Duration.ofMillis(config.getInt(ConfigKey.RETRY_MAX_DELAY_MS.key(), (int) DEFAULT_MAX_DELAY_MS)),
                uniformJitter(config.getInt(ConfigKey.RETRY_JITTER_MS.key(), (int) DEFAULT_JITTER_MS)),
                Duration.ofMillis(config.getInt(ConfigKey.RETRY_RATE_LIMIT_DEFAULT_MS.key(), (int) DEFAULT_RATE_LIMIT_MS)),
                config.getInt(ConfigKey.RETRY_MAX_RATE_LIMIT_WAITS.key(), DEFAULT_MAX_RATE_LIMIT_WAITS));
    }

    /** Uniform random jitter in {@code [0, maxMs]}. */
    public static Supplier<Duration> uniformJitter(long maxMs) {
        if (maxMs <= 0) return () -> Duration.ZERO;
        return () -> Duration.ofMillis(ThreadLocalRandom.current().nextLong(maxMs + 1));
    }

    public Duration delayFor(int attempt) {
        if (attempt < 0) throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        double raw = baseDelay.toMillis() * Math.pow(multiplier, attempt);
        long capped = (long) Math.min((double) maxDelay.toMillis(), raw);
        return Duration.ofMillis(capped).plus(jitter.get());
    }

    public RetryPolicy withoutJitter() {
        return new RetryPolicy(maxAttempts, baseDelay, multiplier, maxDelay, () -> Duration.ZERO,
                rateLimitDefault, maxRateLimitWaits);
    }
}
