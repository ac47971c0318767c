package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.Preconditions;
import co.fanki.codereview.shared.ValueObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Value object holding the SHA-256 digest of a file's content.
 *
 * <p>The fingerprint is a pure function of the content. Cache entries are
 * keyed by it, so it must stay collision resistant: SHA-256 is used rather
 * than a short or non-cryptographic hash.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ContentFingerprint implements ValueObject {

    private static final long serialVersionUID = 1L;

    private static final Pattern HEX_SHA256 = Pattern.compile("^[0-9a-f]{64}$");

    private final String value;

    private ContentFingerprint(final String theValue) {
        Preconditions.requireNonBlank(theValue,
                "Fingerprint cannot be null or blank");
        Preconditions.require(HEX_SHA256.matcher(theValue).matches(),
                "Invalid fingerprint format: " + theValue);
        this.value = theValue;
    }

    /**
     * Computes the fingerprint of the given content.
     *
     * @param content the file content, never null
     * @return the fingerprint of the UTF-8 bytes of the content
     */
    public static ContentFingerprint of(final String content) {
        Preconditions.requireNonNull(content, "Content is required");
        return new ContentFingerprint(sha256Hex(content));
    }

    /**
     * Rebuilds a fingerprint from its hex representation.
     *
     * @param hex the 64 character lowercase hex digest
     * @return the fingerprint
     * @throws IllegalArgumentException if the value is not a SHA-256 hex digest
     */
    public static ContentFingerprint fromHex(final String hex) {
        return new ContentFingerprint(hex);
    }

    /**
     * Hashes an arbitrary string with SHA-256 and returns lowercase hex.
     *
     * @param text the text to hash
     * @return the hex digest
     */
    public static String sha256Hex(final String text) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(
                    digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns the hex digest.
     *
     * @return the digest string
     */
    public String value() {
        return value;
    }

    /**
     * Returns the first characters of the digest, for logging.
     *
     * @return a 12 character prefix
     */
    public String shortValue() {
        return value.substring(0, 12);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ContentFingerprint that = (ContentFingerprint) obj;
        return value.equals(that.value);
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
