package co.fanki.codereview.cache.domain;

import co.fanki.codereview.review.domain.ContentFingerprint;

import java.time.Duration;
import java.util.Optional;

/**
 * Store of serialized producer outcomes.
 *
 * <p>Every method may throw {@link CacheAccessException} when the backing
 * store is unavailable. Expired entries are never returned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ResultCache {

    /**
     * Looks up a live entry.
     *
     * @param key the key
     * @return the stored payload, exactly as put
     */
    Optional<String> get(CacheKey key);

    /**
     * Stores a payload, replacing any previous one.
     *
     * @param key the key
     * @param payload the serialized outcome
     * @param ttl how long the entry lives
     */
    void put(CacheKey key, String payload, Duration ttl);

    /**
     * Deletes the entries of a path computed over other contents.
     *
     * @param path the file path
     * @param current the fingerprint to keep
     * @return the number of deleted entries
     */
    int deleteStale(String path, ContentFingerprint current);

    /**
     * Deletes every expired entry.
     *
     * @return the number of deleted entries
     */
    int deleteExpired();

    /**
     * Deletes every entry.
     *
     * @return the number of deleted entries
     */
    int clear();

    /**
     * Returns the store counters.
     *
     * @return the stats
     */
    CacheStats stats();

}
