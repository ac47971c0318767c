package co.fanki.codereview.review.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Drops finished reviews once their retention elapses.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ReviewRetentionScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReviewRetentionScheduler.class);

    private final ReviewRegistry registry;
    private final Clock clock;
    private final Duration retention;

    /**
     * Creates a new ReviewRetentionScheduler.
     *
     * @param theRegistry the review registry
     * @param theClock the clock
     * @param theRetention how long terminal reviews stay pollable
     */
    public ReviewRetentionScheduler(final ReviewRegistry theRegistry,
            final Clock theClock,
            @Value("${review.registry.retention:24h}") final Duration theRetention) {
        this.registry = theRegistry;
        this.clock = theClock;
        this.retention = theRetention;
    }

    /**
     * Purges the expired terminal reviews.
     */
    @Scheduled(cron = "${review.registry.sweep-cron:0 0 * * * *}")
    public void purge() {
        final int purged = registry.purgeCompletedBefore(
                clock.instant().minus(retention));
        if (purged > 0) {
            LOG.info("Purged {} finished reviews older than {}", purged,
                    retention);
        }
    }

}
