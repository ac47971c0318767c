package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.Preconditions;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Cancellation signal of one review run.
 *
 * <p>The pipeline checks the token at every suspension point and registers
 * its in-flight futures with it. Cancelling the token cancels those
 * futures, interrupting the threads blocked on provider calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CancellationToken {

    private final String reviewId;

    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    private volatile boolean cancelled;

    /**
     * Creates a token for the given run.
     *
     * @param theReviewId the review id
     */
    public CancellationToken(final String theReviewId) {
        this.reviewId = Preconditions.requireNonBlank(theReviewId,
                "Review id is required");
    }

    /**
     * Cancels the run and every registered future. Idempotent.
     */
    public void cancel() {
        cancelled = true;
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        inFlight.clear();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Tracks a future so that {@link #cancel()} reaches it.
     *
     * <p>A future registered after cancellation is cancelled at once.</p>
     *
     * @param future the in-flight work
     * @param <F> the future type
     * @return the same future
     */
    public <F extends Future<?>> F register(final F future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
            inFlight.remove(future);
        }
        return future;
    }

    /**
     * Stops tracking a future that completed.
     *
     * @param future the finished work
     */
    public void release(final Future<?> future) {
        inFlight.remove(future);
    }

    /**
     * Throws when the run was cancelled.
     *
     * @throws ReviewCancelledException if cancelled
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new ReviewCancelledException(reviewId);
        }
    }

}
