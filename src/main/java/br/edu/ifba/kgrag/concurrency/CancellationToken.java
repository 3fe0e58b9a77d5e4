package br.edu.ifba.kgrag.concurrency;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch-level cancellation flag. Cancelling stops new submissions; tasks
 * already running finish normally.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
