package com.gridbot.application.execution;

import java.time.Duration;

public interface RunHandle {

    String key();

    CancellationToken token();

    /** Cancels the token and stops scheduling new runs; a run in progress is allowed to finish. */
    void stop();

    boolean isRunning();

    /**
     * Waits until no run is in progress.
     *
     * @return false when {@code timeout} elapsed first
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException;
}
