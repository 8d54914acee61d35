package com.gridbot.application.execution.impl;

import com.gridbot.application.execution.CancellationToken;
import com.gridbot.application.execution.CycleTask;
import com.gridbot.application.execution.JobScheduler;
import com.gridbot.application.execution.RunHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduler backed by a {@link ScheduledExecutorService}.
 *
 * <p>Uses fixed-delay scheduling so a slow cycle (exchange backoff, fill polling) pushes the next one
 * back instead of queueing runs behind it.
 */
public class DefaultJobScheduler implements JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultJobScheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<String, Handle> handles = new ConcurrentHashMap<>();

    public DefaultJobScheduler(int threads) {
        this.executor = Executors.newScheduledThreadPool(Math.max(1, threads), new NamedThreadFactory());
    }

    @Override
    public RunHandle scheduleWithFixedDelay(String key, CycleTask task, long initialDelayMs, long delayMs) {
        Handle h = new Handle(key, task);
        Handle previous = handles.put(key, h);
        if (previous != null) previous.stop();
        h.start(initialDelayMs, delayMs);
        return h;
    }

    /**
     * Stops every handle, waits up to {@code grace} for in-flight runs, then shuts the pool down.
     */
    public void shutdown(Duration grace) throws InterruptedException {
        List<Handle> all = new ArrayList<>(handles.values());
        all.forEach(Handle::stop);
        long deadline = System.nanoTime() + grace.toNanos();
        for (Handle h : all) {
            long left = Math.max(0L, deadline - System.nanoTime());
            if (!h.awaitIdle(Duration.ofNanos(left))) {
                log.warn("Cycle {} still running after {} grace period", h.key(), grace);
            }
        }
        executor.shutdown();
        long left = Math.max(0L, deadline - System.nanoTime());
        if (!executor.awaitTermination(left, TimeUnit.NANOSECONDS)) {
            executor.shutdownNow();
        }
    }

    private final class Handle implements RunHandle {
        private final String key;
        private final CycleTask task;
        private final CancellationToken token = new CancellationToken();
        private final Object monitor = new Object();

        private boolean inFlight;
        private volatile ScheduledFuture<?> future;

        private Handle(String key, CycleTask task) {
            this.key = key;
            this.task = task;
        }

        private void start(long initialDelayMs, long delayMs) {
            future = executor.scheduleWithFixedDelay(this::runOnce,
                    Math.max(0L, initialDelayMs), Math.max(1L, delayMs), TimeUnit.MILLISECONDS);
        }

        private void runOnce() {
            synchronized (monitor) {
                if (token.isCancelled()) return;
                inFlight = true;
            }
            try {
                task.run(token);
            } catch (RuntimeException e) {
                // an escaping exception would silently cancel the periodic task
                log.error("Cycle {} failed", key, e);
            } finally {
                synchronized (monitor) {
                    inFlight = false;
                    monitor.notifyAll();
                }
            }
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public CancellationToken token() {
            return token;
        }

        @Override
        public void stop() {
            token.cancel();
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
            handles.remove(key, this);
        }

        @Override
        public boolean isRunning() {
            ScheduledFuture<?> f = future;
            return !token.isCancelled() && f != null && !f.isDone();
        }

        @Override
        public boolean awaitIdle(Duration timeout) throws InterruptedException {
            long deadline = System.nanoTime() + timeout.toNanos();
            synchronized (monitor) {
                while (inFlight) {
                    long leftMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                    if (leftMs <= 0) return false;
                    monitor.wait(leftMs);
                }
                return true;
            }
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "gridbot-cycle-" + seq.incrementAndGet());
            t.setDaemon(false);
            return t;
        }
    }
}
