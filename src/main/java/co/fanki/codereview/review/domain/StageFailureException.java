package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.DomainException;

/**
 * Thrown when a whole stage cannot proceed, e.g. every producer failed.
 *
 * <p>Becomes the terminal error of the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StageFailureException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code for stage failures. */
    public static final String CODE = "REVIEW_STAGE_FAILED";

    private final ReviewStage stage;

    /**
     * Creates the exception.
     *
     * @param theStage the stage that failed
     * @param message what happened
     */
    public StageFailureException(final ReviewStage theStage,
            final String message) {
        super(message, CODE);
        this.stage = theStage;
    }

    /**
     * Creates the exception with a cause.
     *
     * @param theStage the stage that failed
     * @param message what happened
     * @param cause the underlying error
     */
    public StageFailureException(final ReviewStage theStage,
            final String message, final Throwable cause) {
        super(message, CODE, cause);
        this.stage = theStage;
    }

    public ReviewStage stage() {
        return stage;
    }

}
