package dev.schemaeval.run;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag shared between a run's owner and its dispatcher. */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** @return true if this call flipped the token */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
