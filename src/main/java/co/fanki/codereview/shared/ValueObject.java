package co.fanki.codereview.shared;

import java.io.Serializable;

/**
 * Marker for immutable review values compared by their attributes.
 *
 * <p>{@code CodeUnit}, {@code ContentFingerprint} and {@code CacheKey} are
 * value objects: they validate in their factories, never change after
 * creation and define equality over all fields.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
