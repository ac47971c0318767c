package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.DomainException;

/**
 * Thrown at a suspension point once the run's token was cancelled.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReviewCancelledException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code for cancelled runs. */
    public static final String CODE = "REVIEW_CANCELLED";

    /**
     * Creates the exception.
     *
     * @param reviewId the cancelled review
     */
    public ReviewCancelledException(final String reviewId) {
        super("Review cancelled: " + reviewId, CODE);
    }

}
