package co.fanki.codereview.hosting.domain;

import co.fanki.codereview.shared.DomainException;

/**
 * Thrown when the source hosting service rejects or fails a call.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class HostingException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of hosting failures. */
    public static final String CODE = "HOSTING_FAILED";

    /**
     * Creates the exception.
     *
     * @param message what failed
     * @param cause the underlying error, may be null
     */
    public HostingException(final String message, final Throwable cause) {
        super(message, CODE, cause);
    }

}
