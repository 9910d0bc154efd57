package com.catalog.quality.normalization;

/**
 * Cooperative stop signal for one session. Workers poll it between batches only.
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
