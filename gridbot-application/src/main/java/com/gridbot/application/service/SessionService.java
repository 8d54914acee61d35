package com.gridbot.application.service;

import com.gridbot.application.execution.JobScheduler;
import com.gridbot.application.execution.RunHandle;
import com.gridbot.application.usecase.CycleOutcome;
import com.gridbot.application.usecase.CycleResult;
import com.gridbot.application.usecase.TradeLoop;
import com.gridbot.domain.market.MarketSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts and stops one trade loop per symbol. Entry point for the CLI.
 *
 * <p>A loop that reports {@link CycleOutcome#HALTED} is stopped here; the other symbols keep running.
 */
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final JobScheduler scheduler;

    private final Map<MarketSymbol, RunHandle> sessions = new ConcurrentHashMap<>();
    private final Map<MarketSymbol, TradeLoop> loops = new ConcurrentHashMap<>();
    private final Map<MarketSymbol, Instant> lastTick = new ConcurrentHashMap<>();
    private final Map<MarketSymbol, CycleResult> lastResult = new ConcurrentHashMap<>();

    public SessionService(JobScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public synchronized void start(TradeLoop loop, Duration period) {
        Objects.requireNonNull(loop, "loop");
        MarketSymbol symbol = loop.symbol();

        RunHandle existing = sessions.get(symbol);
        if (existing != null && existing.isRunning()) {
            log.warn("Session already running: {}", symbol);
            return;
        }

        AtomicReference<RunHandle> self = new AtomicReference<>();
        RunHandle handle = scheduler.scheduleWithFixedDelay(symbol.key(), token -> {
            CycleResult r = loop.runCycle(token);
            lastTick.put(symbol, Instant.now());
            lastResult.put(symbol, r);
            if (r.outcome() == CycleOutcome.HALTED) {
                RunHandle h = self.get();
                if (h != null && h.isRunning()) {
                    log.error("Session {} halted: {}", symbol, r.message());
                    h.stop();
                }
            }
        }, 0, Math.max(250L, period.toMillis()));
        self.set(handle);

        sessions.put(symbol, handle);
        loops.put(symbol, loop);
        log.info("Session started: {} every {}s", symbol, period.toSeconds());
    }

    public synchronized void stop(MarketSymbol symbol) {
        RunHandle h = sessions.remove(symbol);
        if (h != null) {
            h.stop();
            log.info("Session stopped: {}", symbol);
        } else {
            log.warn("No session: {}", symbol);
        }
    }

    /**
     * Stops every session and waits up to {@code grace} for the cycles in progress, including any
     * order result and ledger write they are busy with. A loop that went idle with an order still
     * unresolved gets one last lookup of that order; if it stays unresolved it remains in the
     * persisted state for the next start.
     *
     * @return true when every cycle finished within the grace period
     */
    public boolean stopAll(Duration grace) throws InterruptedException {
        Map<MarketSymbol, RunHandle> handles;
        synchronized (this) {
            handles = new LinkedHashMap<>(sessions);
            sessions.clear();
        }
        handles.values().forEach(RunHandle::stop);

        long deadline = System.nanoTime() + grace.toNanos();
        boolean idle = true;
        for (Map.Entry<MarketSymbol, RunHandle> e : handles.entrySet()) {
            RunHandle h = e.getValue();
            Duration left = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
            if (!h.awaitIdle(left)) {
                log.warn("Session {} did not finish its cycle within {}", h.key(), grace);
                idle = false;
                continue;
            }
            resolveOnStop(loops.get(e.getKey()));
        }
        log.info("Stopped {} session(s)", handles.size());
        return idle;
    }

    private void resolveOnStop(TradeLoop loop) {
        if (loop == null || !loop.hasPendingOrder()) return;
        if (loop.resolvePendingOrder()) {
            log.info("[SYNC] {} pending order resolved before stop", loop.symbol());
        } else {
            log.warn("[SYNC] {} order still unresolved, it will be looked up on next start", loop.symbol());
        }
    }

    public boolean isRunning(MarketSymbol symbol) {
        RunHandle h = sessions.get(symbol);
        return h != null && h.isRunning();
    }

    public CycleResult lastResult(MarketSymbol symbol) {
        return lastResult.get(symbol);
    }

    /** Symbol -> RUNNING/STOPPED/HALTED plus the last cycle outcome. */
    public Map<MarketSymbol, String> status() {
        Map<MarketSymbol, String> out = new LinkedHashMap<>();
        for (Map.Entry<MarketSymbol, CycleResult> e : lastResult.entrySet()) {
            out.put(e.getKey(), describe(e.getKey()));
        }
        for (MarketSymbol s : sessions.keySet()) {
            out.putIfAbsent(s, describe(s));
        }
        return out;
    }

    /** Human-readable status for the CLI. */
    public String statusText() {
        Map<MarketSymbol, String> status = status();
        if (status.isEmpty()) return "No active sessions.";
        StringBuilder sb = new StringBuilder();
        sb.append("Sessions: ").append(status.size()).append("\n");
        status.forEach((s, text) -> sb.append("- ").append(s).append(" : ").append(text).append("\n"));
        return sb.toString().trim();
    }

    private String describe(MarketSymbol symbol) {
        CycleResult r = lastResult.get(symbol);
        String state;
        if (r != null && r.outcome() == CycleOutcome.HALTED) state = "HALTED";
        else if (isRunning(symbol)) state = "RUNNING";
        else state = "STOPPED";

        Instant lt = lastTick.get(symbol);
        StringBuilder sb = new StringBuilder(state)
                .append(" | lastTick=").append(lt == null ? "never" : lt.toString());
        if (r != null) sb.append(" | last=").append(r.outcome()).append(" ").append(r.message());
        return sb.toString();
    }
}
