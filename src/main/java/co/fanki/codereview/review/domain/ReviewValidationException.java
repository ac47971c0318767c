package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.DomainException;

/**
 * Thrown when a review request is rejected before the pipeline starts.
 *
 * <p>No run exists when this is thrown.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReviewValidationException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code for invalid requests. */
    public static final String CODE = "REVIEW_INVALID";

    /**
     * Creates the exception.
     *
     * @param message what is wrong with the request
     */
    public ReviewValidationException(final String message) {
        super(message, CODE);
    }

}
