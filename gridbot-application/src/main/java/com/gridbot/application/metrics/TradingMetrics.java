package com.gridbot.application.metrics;

import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.order.Side;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/**
 * Trading counters.
 *
 * Exposes:
 * - gridbot.orders.submitted (symbol, side)
 * - gridbot.orders.filled (symbol, side)
 * - gridbot.orders.rejected (symbol)
 * - gridbot.cycles.failed (symbol)
 * - gridbot.exchange.retries (exchange, reason)
 */
public class TradingMetrics {

    private final MeterRegistry registry;

    public TradingMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics backed by a private in-memory registry (backtests, tests). */
    public static TradingMetrics inMemory() {
        return new TradingMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void orderSubmitted(MarketSymbol symbol, Side side) {
        Counter.builder("gridbot.orders.submitted")
                .description("Orders sent to the exchange")
                .tag("symbol", symbol.key())
                .tag("side", side.name())
                .register(registry)
                .increment();
    }

    public void orderFilled(MarketSymbol symbol, Side side) {
        Counter.builder("gridbot.orders.filled")
                .description("Orders confirmed filled and applied to the ledger")
                .tag("symbol", symbol.key())
                .tag("side", side.name())
                .register(registry)
                .increment();
    }

    public void orderRejected(MarketSymbol symbol) {
        Counter.builder("gridbot.orders.rejected")
                .description("Orders rejected or cancelled without a fill")
                .tag("symbol", symbol.key())
                .register(registry)
                .increment();
    }

    public void cycleFailed(MarketSymbol symbol) {
        Counter.builder("gridbot.cycles.failed")
                .description("Trade cycles that ended with an error")
                .tag("symbol", symbol.key())
                .register(registry)
                .increment();
    }

    public void exchangeRetry(String exchange, String reason) {
        Counter.builder("gridbot.exchange.retries")
                .description("Exchange requests retried after a transient failure")
                .tag("exchange", exchange)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
