package com.musicgraph.harvester.discovery;

import com.musicgraph.harvester.error.OperationCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by the command line, discovery and download loops.
 * Checked between discovery levels, between frontier entities and between track downloads.
 */
public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    /**
     * @param stage description used in the exception message
     * @throws OperationCancelledException if cancellation was requested
     */
    public void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new OperationCancelledException("Cancelled during " + stage);
        }
    }
}
