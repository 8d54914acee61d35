package com.gridbot.application.usecase;

public enum CycleOutcome {
    /** Decision was HOLD. */
    HOLD,
    /** Nothing traded: stale tick, cooldown, sizing, balance or cancellation. */
    SKIPPED,
    FILLED,
    REJECTED,
    CANCELLED,
    /** An order's outcome is unknown; it is reconciled at the start of the next cycle. */
    PENDING,
    /** Recoverable failure, retried next cycle. */
    ERROR,
    /** The symbol's loop stopped after a persistence or ledger failure. */
    HALTED
}
