package co.fanki.codereview.cache.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically purges expired producer results.
 *
 * <p>Expired entries are never served, this only reclaims their space.
 * Disabled when {@code review.cache.enabled=false}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "review.cache.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class CacheEvictionScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            CacheEvictionScheduler.class);

    private final CacheGate cacheGate;

    /**
     * Creates a new CacheEvictionScheduler.
     *
     * @param theCacheGate the cache gate
     */
    public CacheEvictionScheduler(final CacheGate theCacheGate) {
        this.cacheGate = theCacheGate;
    }

    /**
     * Deletes the expired entries.
     */
    @Scheduled(cron = "${review.cache.eviction-cron:0 */10 * * * *}")
    public void evictExpired() {
        final int evicted = cacheGate.evictExpired();
        if (evicted > 0) {
            LOG.info("Evicted {} expired cache entries", evicted);
        } else {
            LOG.debug("No expired cache entries");
        }
    }

}
