package com.gridbot.cli.bootstrap;

import com.gridbot.application.config.TradingConfig;
import com.gridbot.application.exchange.ExchangeClient;
import com.gridbot.application.execution.impl.DefaultJobScheduler;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.application.service.SessionService;
import com.gridbot.application.usecase.TradeLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything a running bot owns: one trade loop per symbol, the sessions driving them and the
 * scheduler threads underneath.
 */
public final class GridBotRuntime {

    private static final Logger log = LoggerFactory.getLogger(GridBotRuntime.class);

    private final TradingConfig config;
    private final ExchangeClient exchange;
    private final List<TradeLoop> loops;
    private final SessionService sessions;
    private final DefaultJobScheduler scheduler;
    private final TradingMetrics metrics;
    private final AtomicBoolean shutDown = new AtomicBoolean();

    GridBotRuntime(TradingConfig config,
                   ExchangeClient exchange,
                   List<TradeLoop> loops,
                   SessionService sessions,
                   DefaultJobScheduler scheduler,
                   TradingMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.loops = List.copyOf(loops);
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public TradingConfig config() { return config; }

    public ExchangeClient exchange() { return exchange; }

    public List<TradeLoop> loops() { return loops; }

    public SessionService sessions() { return sessions; }

    public TradingMetrics metrics() { return metrics; }

    public void start() {
        for (TradeLoop loop : loops) {
            sessions.start(loop, config.refresh());
        }
        log.info("Started {} session(s) on {} (dryRun={})", loops.size(), exchange.id(), config.dryRun());
    }

    /** True while at least one symbol is still trading. */
    public boolean isActive() {
        return loops.stream().anyMatch(l -> sessions.isRunning(l.symbol()));
    }

    /**
     * Stops all sessions, lets in-flight cycles finish within {@code grace}, then stops the threads.
     * Safe to call more than once.
     *
     * @return true when every cycle finished within the grace period
     */
    public boolean shutdown(Duration grace) throws InterruptedException {
        if (!shutDown.compareAndSet(false, true)) return true;
        log.info("Shutting down, waiting up to {}s for running cycles", grace.toSeconds());
        boolean idle = sessions.stopAll(grace);
        scheduler.shutdown(grace);
        log.info(sessions.statusText());
        return idle;
    }
}
