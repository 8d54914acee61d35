package com.gridbot.application.ports;

import java.time.Duration;

/**
 * Blocking wait used for backoff and fill polling. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> Thread.sleep(Math.max(0L, d.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
