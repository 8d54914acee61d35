package com.gridbot.application.execution;

/**
 * Cooperative stop signal for one session. Checked by the trade loop between steps; never
 * interrupts an order that is already on its way to the exchange.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
