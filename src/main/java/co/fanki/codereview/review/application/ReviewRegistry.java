package co.fanki.codereview.review.application;

import co.fanki.codereview.review.domain.ReviewRun;
import co.fanki.codereview.review.domain.ReviewStatus;
import co.fanki.codereview.shared.DomainException;
import co.fanki.codereview.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-wide store of review runs, keyed by review id.
 *
 * <p>The map is concurrent; each run guards its own state, and
 * {@link #update(String, Consumer)} applies a mutator while holding the
 * run's monitor, so {@link #get(String)} always returns a snapshot taken
 * between two whole mutations.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReviewRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReviewRegistry.class);

    /** Error code raised when registering an id twice. */
    public static final String DUPLICATE = "REVIEW_DUPLICATE";

    private final Map<String, ReviewRun> runs = new ConcurrentHashMap<>();

    /**
     * Registers a new run.
     *
     * @param run the pending run
     * @throws DomainException if a run with the same id exists
     */
    public void create(final ReviewRun run) {
        Preconditions.requireNonNull(run, "Review run is required");
        if (runs.putIfAbsent(run.reviewId(), run) != null) {
            throw new DomainException("Review already registered: "
                    + run.reviewId(), DUPLICATE);
        }
        LOG.debug("Registered review {}", run.reviewId());
    }

    /**
     * Applies a mutation to a run.
     *
     * @param reviewId the review id
     * @param mutator the mutation, run under the run's monitor
     * @return false when the run is absent
     */
    public boolean update(final String reviewId,
            final Consumer<ReviewRun> mutator) {
        final ReviewRun run = runs.get(reviewId);
        if (run == null) {
            return false;
        }
        synchronized (run) {
            mutator.accept(run);
        }
        return true;
    }

    /**
     * Returns a consistent snapshot of a run.
     *
     * @param reviewId the review id
     * @return the status, empty when absent
     */
    public Optional<ReviewStatus> get(final String reviewId) {
        if (reviewId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(runs.get(reviewId)).map(ReviewRun::snapshot);
    }

    /**
     * Removes a run and cancels its in-flight work.
     *
     * @param reviewId the review id
     * @return false when the run is absent
     */
    public boolean delete(final String reviewId) {
        if (reviewId == null) {
            return false;
        }
        final ReviewRun run = runs.remove(reviewId);
        if (run == null) {
            return false;
        }
        run.cancellationToken().cancel();
        LOG.info("Deleted review {} at stage {}", reviewId,
                run.stage().wireName());
        return true;
    }

    public int size() {
        return runs.size();
    }

    /**
     * Removes terminal runs completed before the cutoff.
     *
     * @param cutoff the oldest completion time kept
     * @return the number removed
     */
    public int purgeCompletedBefore(final Instant cutoff) {
        int purged = 0;
        final Iterator<ReviewRun> it = runs.values().iterator();
        while (it.hasNext()) {
            final ReviewRun run = it.next();
            final Instant completedAt = run.completedAt();
            if (completedAt != null && completedAt.isBefore(cutoff)) {
                it.remove();
                purged++;
            }
        }
        return purged;
    }

}
