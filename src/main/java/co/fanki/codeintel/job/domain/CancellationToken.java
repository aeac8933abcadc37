package co.fanki.codeintel.job.domain;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to a worker at launch.
 *
 * <p>The worker polls it at its own checkpoints; nothing is
 * interrupted.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** Requests cancellation. Idempotent. */
    public void cancel() {
        cancelled.set(true);
    }

    /**
     * Whether cancellation was requested.
     *
     * @return true once {@link #cancel()} was called
     */
    public boolean isCancellationRequested() {
        return cancelled.get();
    }

}
