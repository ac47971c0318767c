package co.fanki.codereview.review.domain;

import java.time.Instant;

/**
 * Consistent point-in-time view of a review run.
 *
 * @param reviewId the review id
 * @param stage the current stage
 * @param progress the progress percentage
 * @param result the report, only when complete
 * @param error the terminal error, only when failed
 * @param createdAt when the review was submitted
 * @param completedAt when it reached a terminal stage, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReviewStatus(
        String reviewId,
        ReviewStage stage,
        int progress,
        ReviewReport result,
        String error,
        Instant createdAt,
        Instant completedAt) {

    /**
     * Checks whether the run can no longer change.
     *
     * @return true when complete or failed
     */
    public boolean terminal() {
        return stage.isTerminal();
    }

}
