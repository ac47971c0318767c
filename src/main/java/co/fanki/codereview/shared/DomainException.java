package co.fanki.codereview.shared;

/**
 * Base exception for review-domain errors.
 *
 * <p>Every domain exception carries an error code so that callers (REST
 * controllers, MCP tools, status polling) can report a stable identifier
 * next to the human readable message.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code used when none is given. */
    public static final String DEFAULT_CODE = "REVIEW_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception with the default error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, DEFAULT_CODE);
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
