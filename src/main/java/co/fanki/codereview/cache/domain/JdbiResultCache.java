package co.fanki.codereview.cache.domain;

import co.fanki.codereview.review.domain.ContentFingerprint;
import co.fanki.codereview.shared.Preconditions;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Result store backed by the {@code producer_result_cache} table.
 *
 * <p>The {@code path} column is indexed and serves as the reverse index used
 * to drop entries computed over previous contents of a file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JdbiResultCache implements ResultCache {

    /** Find a live entry. Uses: PK index. */
    public static final String FIND_LIVE = """
            SELECT payload FROM producer_result_cache
            WHERE cache_key = :key AND expires_at > :now
            """;

    /** Insert or replace an entry. Uses: PK index. */
    public static final String UPSERT = """
            INSERT INTO producer_result_cache (
                cache_key, path, fingerprint, producer, payload,
                created_at, expires_at
            ) VALUES (
                :key, :path, :fingerprint, :producer, :payload,
                :createdAt, :expiresAt
            )
            ON CONFLICT (cache_key) DO UPDATE SET
                payload = EXCLUDED.payload,
                created_at = EXCLUDED.created_at,
                expires_at = EXCLUDED.expires_at
            """;

    /** Delete entries of older contents. Uses: idx_producer_result_cache_path. */
    public static final String DELETE_STALE = """
            DELETE FROM producer_result_cache
            WHERE path = :path AND fingerprint <> :fingerprint
            """;

    /** Delete expired entries. Uses: idx_producer_result_cache_expires. */
    public static final String DELETE_EXPIRED =
            "DELETE FROM producer_result_cache WHERE expires_at <= :now";

    /** Count live entries. Uses: idx_producer_result_cache_expires. */
    public static final String COUNT_LIVE =
            "SELECT COUNT(*) FROM producer_result_cache WHERE expires_at > :now";

    private final Jdbi jdbi;

    private final Clock clock;

    private final LongAdder hits = new LongAdder();

    private final LongAdder misses = new LongAdder();

    /**
     * Creates the store.
     *
     * @param theJdbi the JDBI instance
     * @param theClock the clock deciding expiry
     */
    public JdbiResultCache(final Jdbi theJdbi, final Clock theClock) {
        this.jdbi = Preconditions.requireNonNull(theJdbi, "Jdbi is required");
        this.clock = Preconditions.requireNonNull(theClock, "Clock is required");
    }

    @Override
    public Optional<String> get(final CacheKey key) {
        try {
            final Optional<String> payload = jdbi.withHandle(handle -> handle
                    .createQuery(FIND_LIVE)
                    .bind("key", key.value())
                    .bind("now", now())
                    .mapTo(String.class)
                    .findOne());
            if (payload.isPresent()) {
                hits.increment();
            } else {
                misses.increment();
            }
            return payload;
        } catch (final JdbiException e) {
            throw new CacheAccessException("Cannot read " + key, e);
        }
    }

    @Override
    public void put(final CacheKey key, final String payload,
            final Duration ttl) {
        final Instant createdAt = clock.instant();
        try {
            jdbi.useHandle(handle -> handle.createUpdate(UPSERT)
                    .bind("key", key.value())
                    .bind("path", key.path())
                    .bind("fingerprint", key.fingerprint().value())
                    .bind("producer", key.producer())
                    .bind("payload", payload)
                    .bind("createdAt", Timestamp.from(createdAt))
                    .bind("expiresAt", Timestamp.from(createdAt.plus(ttl)))
                    .execute());
        } catch (final JdbiException e) {
            throw new CacheAccessException("Cannot write " + key, e);
        }
    }

    @Override
    public int deleteStale(final String path, final ContentFingerprint current) {
        try {
            return jdbi.withHandle(handle -> handle.createUpdate(DELETE_STALE)
                    .bind("path", path)
                    .bind("fingerprint", current.value())
                    .execute());
        } catch (final JdbiException e) {
            throw new CacheAccessException("Cannot invalidate " + path, e);
        }
    }

    @Override
    public int deleteExpired() {
        try {
            return jdbi.withHandle(handle -> handle.createUpdate(DELETE_EXPIRED)
                    .bind("now", now())
                    .execute());
        } catch (final JdbiException e) {
            throw new CacheAccessException("Cannot purge expired entries", e);
        }
    }

    @Override
    public int clear() {
        try {
            return jdbi.withHandle(handle -> handle
                    .createUpdate("DELETE FROM producer_result_cache")
                    .execute());
        } catch (final JdbiException e) {
            throw new CacheAccessException("Cannot clear the cache", e);
        }
    }

    @Override
    public CacheStats stats() {
        try {
            final long entries = jdbi.withHandle(handle -> handle
                    .createQuery(COUNT_LIVE)
                    .bind("now", now())
                    .mapTo(Long.class)
                    .one());
            return new CacheStats("jdbc", entries, hits.sum(), misses.sum());
        } catch (final JdbiException e) {
            throw new CacheAccessException("Cannot count entries", e);
        }
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

}
