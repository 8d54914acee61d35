package com.gridbot.application.execution;

/**
 * One unit of repeated work. Receives the token of the session it runs in.
 */
@FunctionalInterface
public interface CycleTask {
    void run(CancellationToken token);
}
