package co.fanki.codereview.cache.domain;

import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.ContentFingerprint;
import co.fanki.codereview.shared.Preconditions;
import co.fanki.codereview.shared.ValueObject;

/**
 * Identity of one cached producer outcome: a producer run over one exact
 * file content at one path.
 *
 * <p>The string form is {@code review:{producer}:{sha256(path:fingerprint:producer)}}.
 * It is a pure function of its three parts, so equal inputs always meet
 * the same entry and any content change yields a new key.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CacheKey implements ValueObject {

    private static final long serialVersionUID = 1L;

    private static final String PREFIX = "review:";

    private final String path;
    private final ContentFingerprint fingerprint;
    private final String producer;
    private final String value;

    private CacheKey(final String thePath,
            final ContentFingerprint theFingerprint, final String theProducer) {
        this.path = Preconditions.requireNonBlank(thePath, "Path is required");
        this.fingerprint = Preconditions.requireNonNull(theFingerprint,
                "Fingerprint is required");
        this.producer = Preconditions.requireNonBlank(theProducer,
                "Producer is required");
        this.value = PREFIX + theProducer + ":" + ContentFingerprint.sha256Hex(
                thePath + ":" + theFingerprint.value() + ":" + theProducer);
    }

    /**
     * Creates the key of a producer run over a code unit.
     *
     * @param unit the file
     * @param producer the producer name
     * @return the key
     */
    public static CacheKey of(final CodeUnit unit, final String producer) {
        Preconditions.requireNonNull(unit, "Code unit is required");
        return new CacheKey(unit.path(), unit.fingerprint(), producer);
    }

    /**
     * Creates a key from its parts.
     *
     * @param path the file path
     * @param fingerprint the content fingerprint
     * @param producer the producer name
     * @return the key
     */
    public static CacheKey of(final String path,
            final ContentFingerprint fingerprint, final String producer) {
        return new CacheKey(path, fingerprint, producer);
    }

    public String path() {
        return path;
    }

    public ContentFingerprint fingerprint() {
        return fingerprint;
    }

    public String producer() {
        return producer;
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return value.equals(((CacheKey) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }

}
