package com.deepansh.billbot.session;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative stop flag. Once cancelled it stays cancelled. */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** @return true if this call flipped the flag */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
