package co.fanki.codereview.cache.domain;

/**
 * Counters of a result store.
 *
 * @param store the store kind, e.g. {@code "jdbc"}
 * @param entries live entries
 * @param hits lookups answered from the store
 * @param misses lookups that found nothing
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CacheStats(String store, long entries, long hits, long misses) {

    /**
     * Returns the hit ratio.
     *
     * @return hits over lookups, 0 when there were none
     */
    public double hitRatio() {
        final long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

}
