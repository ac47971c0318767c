package co.fanki.codereview.hosting.domain;

import co.fanki.codereview.shared.Preconditions;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Checks the {@code X-Hub-Signature-256} header GitHub sends with each
 * webhook delivery: {@code sha256=} followed by the hex HMAC-SHA256 of the
 * raw body, keyed with the webhook secret.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private static final String PREFIX = "sha256=";

    private final SecretKeySpec key;

    /**
     * Creates a verifier for the given secret.
     *
     * @param secret the webhook secret, never blank
     */
    public WebhookSignatureVerifier(final String secret) {
        Preconditions.requireNonBlank(secret, "Webhook secret is required");
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8),
                ALGORITHM);
    }

    /**
     * Checks a delivery signature in constant time.
     *
     * @param payload the raw request body
     * @param header the signature header, may be null
     * @return true when the header matches the payload
     */
    public boolean verify(final byte[] payload, final String header) {
        if (payload == null || header == null || !header.startsWith(PREFIX)) {
            return false;
        }
        return MessageDigest.isEqual(
                sign(payload).getBytes(StandardCharsets.US_ASCII),
                header.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Computes the header value for a payload.
     *
     * @param payload the raw request body
     * @return {@code sha256=<hex>}
     */
    public String sign(final byte[] payload) {
        try {
            final Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return PREFIX + HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (final NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

}
