package co.fanki.codereview.provider.domain;

import co.fanki.codereview.shared.DomainException;

/**
 * Thrown when a model provider cannot return a usable completion.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ProviderException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of provider failures. */
    public static final String CODE = "PROVIDER_FAILED";

    /** Whether retrying the same call could succeed. */
    public enum Kind {
        /** Timeouts, throttling, 5xx responses. */
        TRANSIENT,
        /** Bad credentials, bad requests, unusable content. */
        PERMANENT
    }

    private final String provider;
    private final Kind kind;

    /**
     * Creates the exception.
     *
     * @param theProvider the provider name
     * @param theKind the failure kind
     * @param message what happened
     */
    public ProviderException(final String theProvider, final Kind theKind,
            final String message) {
        super(message, CODE);
        this.provider = theProvider;
        this.kind = theKind;
    }

    /**
     * Creates the exception with a cause.
     *
     * @param theProvider the provider name
     * @param theKind the failure kind
     * @param message what happened
     * @param cause the underlying error
     */
    public ProviderException(final String theProvider, final Kind theKind,
            final String message, final Throwable cause) {
        super(message, CODE, cause);
        this.provider = theProvider;
        this.kind = theKind;
    }

    public String provider() {
        return provider;
    }

    public Kind kind() {
        return kind;
    }

}
