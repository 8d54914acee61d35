package com.gridbot.exchange;

import java.io.IOException;
import java.util.concurrent.Semaphore;

/**
 * Fair bound on concurrent HTTP calls, shared by every symbol loop talking to one exchange.
 * A permit covers one HTTP attempt; callers release it before sleeping for backoff.
 */
public final class RequestGate {

    public static final int DEFAULT_PERMITS = 4;

    private final Semaphore permits;
    private final int size;

    public RequestGate(int size) {
        if (size < 1) throw new IllegalArgumentException("gate size must be >= 1, got " + size);
        this.size = size;
        this.permits = new Semaphore(size, true);
    }

    public <T> T call(GatedCall<T> call) throws IOException, InterruptedException {
        permits.acquire();
        try {
            return call.run();
        } finally {
            permits.release();
        }
    }

    public int size() {
        return size;
    }

    public int available() {
        return permits.availablePermits();
    }

    @FunctionalInterface
    public interface GatedCall<T> {
        T run() throws IOException;
    }
}
