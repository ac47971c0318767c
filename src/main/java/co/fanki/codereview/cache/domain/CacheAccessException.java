package co.fanki.codereview.cache.domain;

import co.fanki.codereview.shared.DomainException;

/**
 * Thrown by a result store that cannot be read or written.
 *
 * <p>Never fails a review: the cache gate logs it and carries on as if the
 * entry were absent.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CacheAccessException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of cache failures. */
    public static final String CODE = "CACHE_UNAVAILABLE";

    /**
     * Creates the exception.
     *
     * @param message what failed
     * @param cause the store error
     */
    public CacheAccessException(final String message, final Throwable cause) {
        super(message, CODE, cause);
    }

}
