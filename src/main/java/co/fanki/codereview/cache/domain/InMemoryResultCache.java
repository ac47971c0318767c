package co.fanki.codereview.cache.domain;

import co.fanki.codereview.review.domain.ContentFingerprint;
import co.fanki.codereview.shared.Preconditions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Result store kept in the process heap.
 *
 * <p>Used when no database is configured and in tests. Entries are lost on
 * restart.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemoryResultCache implements ResultCache {

    private final Map<CacheKey, Entry> entries = new ConcurrentHashMap<>();

    private final Clock clock;

    private final LongAdder hits = new LongAdder();

    private final LongAdder misses = new LongAdder();

    /**
     * Creates the store.
     *
     * @param theClock the clock deciding expiry
     */
    public InMemoryResultCache(final Clock theClock) {
        this.clock = Preconditions.requireNonNull(theClock, "Clock is required");
    }

    @Override
    public Optional<String> get(final CacheKey key) {
        final Entry entry = entries.get(key);
        if (entry == null || entry.expiredAt(clock.instant())) {
            if (entry != null) {
                entries.remove(key, entry);
            }
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.payload());
    }

    @Override
    public void put(final CacheKey key, final String payload,
            final Duration ttl) {
        Preconditions.requireNonNull(payload, "Payload is required");
        entries.put(key, new Entry(payload, clock.instant().plus(ttl)));
    }

    @Override
    public int deleteStale(final String path, final ContentFingerprint current) {
        final int before = entries.size();
        entries.keySet().removeIf(key -> key.path().equals(path)
                && !key.fingerprint().equals(current));
        return Math.max(0, before - entries.size());
    }

    @Override
    public int deleteExpired() {
        final Instant now = clock.instant();
        final int before = entries.size();
        entries.values().removeIf(entry -> entry.expiredAt(now));
        return Math.max(0, before - entries.size());
    }

    @Override
    public int clear() {
        final int size = entries.size();
        entries.clear();
        return size;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats("memory", entries.size(), hits.sum(),
                misses.sum());
    }

    private record Entry(String payload, Instant expiresAt) {

        boolean expiredAt(final Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

}
