package co.fanki.codereview.cache.application;

import co.fanki.codereview.cache.domain.CacheAccessException;
import co.fanki.codereview.cache.domain.CacheKey;
import co.fanki.codereview.cache.domain.CacheStats;
import co.fanki.codereview.cache.domain.ResultCache;
import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.ProducerOutcome;
import co.fanki.codereview.review.domain.ReviewCancelledException;
import co.fanki.codereview.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Content-addressed gate in front of the producers.
 *
 * <p>For a (file, producer) pair the gate answers from the result store
 * when it holds an entry for the exact content, and otherwise computes the
 * outcome once. Concurrent misses on the same key, from any review, share
 * a single computation. Only successful outcomes are stored.</p>
 *
 * <p>The store is best effort: a {@link CacheAccessException} is logged and
 * handled as a miss or a skipped write, never propagated.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CacheGate {

    private static final Logger LOG = LoggerFactory.getLogger(CacheGate.class);

    private final ResultCache store;

    private final ObjectMapper objectMapper;

    private final Duration ttl;

    private final boolean enabled;

    private final ConcurrentHashMap<CacheKey, CompletableFuture<ProducerOutcome>>
            inFlight = new ConcurrentHashMap<>();

    private final LongAdder shared = new LongAdder();

    /**
     * Creates the gate.
     *
     * @param theStore the result store
     * @param theObjectMapper the mapper used for payloads
     * @param theTtl the entry lifetime
     * @param isEnabled false to bypass the store and the in-flight sharing
     */
    public CacheGate(final ResultCache theStore,
            final ObjectMapper theObjectMapper, final Duration theTtl,
            final boolean isEnabled) {
        this.store = Preconditions.requireNonNull(theStore,
                "Result store is required");
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "ObjectMapper is required");
        this.ttl = Preconditions.requireNonNull(theTtl, "TTL is required");
        Preconditions.require(!theTtl.isNegative() && !theTtl.isZero(),
                "TTL must be positive");
        this.enabled = isEnabled;
    }

    /**
     * Returns the outcome of a producer over a file, computing it only when
     * no stored or in-flight result exists.
     *
     * @param unit the file
     * @param producer the producer name
     * @param compute computes the outcome on a miss
     * @return the outcome
     * @throws ReviewCancelledException if the calling thread is interrupted
     *         while waiting for a shared computation
     */
    public ProducerOutcome fetch(final CodeUnit unit, final String producer,
            final Supplier<ProducerOutcome> compute) {
        if (!enabled) {
            return compute.get();
        }
        final CacheKey key = CacheKey.of(unit, producer);

        while (true) {
            final ProducerOutcome cached = lookup(key);
            if (cached != null) {
                return cached;
            }

            final CompletableFuture<ProducerOutcome> mine = new CompletableFuture<>();
            final CompletableFuture<ProducerOutcome> running =
                    inFlight.putIfAbsent(key, mine);

            if (running == null) {
                return computeAndStore(key, mine, compute);
            }

            shared.increment();
            LOG.debug("Joining in-flight computation for {}", key);
            try {
                return withoutSpend(running.get());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReviewCancelledException(key.value());
            } catch (final ExecutionException e) {
                if (!(e.getCause() instanceof CancellationException
                        || e.getCause() instanceof ReviewCancelledException)) {
                    throw new IllegalStateException(
                            "Shared computation failed for " + key, e.getCause());
                }
                LOG.debug("Shared computation for {} was cancelled, retrying",
                        key);
            } catch (final CancellationException e) {
                LOG.debug("Shared computation for {} was cancelled, retrying",
                        key);
            }
        }
    }

    /**
     * Drops the entries computed over other contents of the file's path.
     *
     * @param unit the current file
     */
    public void invalidateStale(final CodeUnit unit) {
        if (!enabled) {
            return;
        }
        try {
            final int deleted = store.deleteStale(unit.path(),
                    unit.fingerprint());
            if (deleted > 0) {
                LOG.info("Invalidated {} stale cache entries for {}",
                        deleted, unit.path());
            }
        } catch (final CacheAccessException e) {
            LOG.warn("Cache invalidation failed for {}: {}", unit.path(),
                    e.getMessage());
        }
    }

    /**
     * Purges expired entries.
     *
     * @return the number purged, 0 when the store is unavailable
     */
    public int evictExpired() {
        try {
            return store.deleteExpired();
        } catch (final CacheAccessException e) {
            LOG.warn("Cache eviction failed: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Returns the store counters.
     *
     * @return the stats, or null when the store is unavailable
     */
    public CacheStats stats() {
        try {
            return store.stats();
        } catch (final CacheAccessException e) {
            LOG.warn("Cache stats unavailable: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Returns how many lookups joined a computation already in flight.
     *
     * @return the count
     */
    public long sharedComputations() {
        return shared.sum();
    }

    public boolean enabled() {
        return enabled;
    }

    private ProducerOutcome lookup(final CacheKey key) {
        final String payload;
        try {
            payload = store.get(key).orElse(null);
        } catch (final CacheAccessException e) {
            LOG.warn("Cache read failed for {}, treating as miss: {}", key,
                    e.getMessage());
            return null;
        }
        if (payload == null) {
            return null;
        }
        try {
            final ProducerOutcome outcome = objectMapper.readValue(payload,
                    ProducerOutcome.class);
            LOG.debug("Cache hit for {}", key);
            return withoutSpend(outcome);
        } catch (final JsonProcessingException e) {
            LOG.warn("Unreadable cache entry {}, treating as miss: {}", key,
                    e.getOriginalMessage());
            return null;
        }
    }

    /** The caller did not pay for this outcome: cost and time are zero. */
    private static ProducerOutcome withoutSpend(final ProducerOutcome outcome) {
        return new ProducerOutcome(outcome.producerName(), outcome.findings(),
                outcome.narrative(), outcome.qualityScore(), 0L, 0.0,
                outcome.succeeded(), outcome.error());
    }

    private ProducerOutcome computeAndStore(final CacheKey key,
            final CompletableFuture<ProducerOutcome> mine,
            final Supplier<ProducerOutcome> compute) {
        try {
            final ProducerOutcome outcome = compute.get();
            if (outcome.succeeded()) {
                write(key, outcome);
            }
            mine.complete(outcome);
            return outcome;
        } catch (final RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private void write(final CacheKey key, final ProducerOutcome outcome) {
        try {
            store.put(key, objectMapper.writeValueAsString(outcome), ttl);
        } catch (final CacheAccessException e) {
            LOG.warn("Cache write failed for {}: {}", key, e.getMessage());
        } catch (final JsonProcessingException e) {
            LOG.warn("Cannot serialize outcome for {}: {}", key,
                    e.getOriginalMessage());
        }
    }

}
