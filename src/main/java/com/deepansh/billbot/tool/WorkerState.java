package com.deepansh.billbot.tool;

/**
 * Supervision states of the tool worker.
 *
 * STOPPED → STARTING → READY → (exit) → RESTARTING → READY ...
 * Repeated failed starts move to CIRCUIT_OPEN, where calls fail fast until the
 * breaker's cooldown elapses and a single trial start is attempted.
 */
public enum WorkerState {
    STOPPED,
    STARTING,
    READY,
    RESTARTING,
    CIRCUIT_OPEN
}
