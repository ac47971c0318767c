package co.fanki.codereview.review.application;

import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.ReviewOptions;
import co.fanki.codereview.review.domain.ReviewRun;
import co.fanki.codereview.review.domain.ReviewStage;
import co.fanki.codereview.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ReviewRegistry}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReviewRegistryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private ReviewRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ReviewRegistry();
    }

    @Test
    void whenCreating_givenSameIdTwice_shouldThrowDuplicate() {
        registry.create(run("r-1", NOW));

        final DomainException e = assertThrows(DomainException.class,
                () -> registry.create(run("r-1", NOW)));
        assertEquals(ReviewRegistry.DUPLICATE, e.getErrorCode());
    }

    @Test
    void whenUpdating_givenRegisteredRun_shouldExposeChangeInSnapshot() {
        registry.create(run("r-1", NOW));

        assertTrue(registry.update("r-1",
                r -> r.moveTo(ReviewStage.PREPROCESSING)));

        assertEquals(ReviewStage.PREPROCESSING,
                registry.get("r-1").orElseThrow().stage());
        assertEquals(10, registry.get("r-1").orElseThrow().progress());
    }

    @Test
    void whenUpdating_givenUnknownRun_shouldReturnFalse() {
        assertFalse(registry.update("missing",
                r -> r.moveTo(ReviewStage.PREPROCESSING)));
    }

    @Test
    void whenDeleting_givenRunningReview_shouldCancelItsToken() {
        final ReviewRun run = run("r-1", NOW);
        registry.create(run);

        assertTrue(registry.delete("r-1"));

        assertTrue(run.cancellationToken().isCancelled());
        assertTrue(registry.get("r-1").isEmpty());
        assertFalse(registry.delete("r-1"));
    }

    @Test
    void whenGetting_givenNullId_shouldReturnEmpty() {
        assertTrue(registry.get(null).isEmpty());
    }

    @Test
    void whenPurging_givenOldTerminalRuns_shouldKeepRecentAndRunning() {
        final ReviewRun old = run("old", NOW.minus(Duration.ofDays(2)));
        final ReviewRun recent = run("recent", NOW);
        final ReviewRun running = run("running", NOW.minus(Duration.ofDays(2)));
        registry.create(old);
        registry.create(recent);
        registry.create(running);
        registry.update("old", r -> r.fail("boom"));
        registry.update("recent", r -> r.fail("boom"));

        final int purged = registry.purgeCompletedBefore(
                NOW.minus(Duration.ofDays(1)));

        assertEquals(1, purged);
        assertTrue(registry.get("old").isEmpty());
        assertEquals(2, registry.size());
    }

    @Test
    void whenSweeping_givenRetention_shouldPurgeThroughScheduler() {
        final ReviewRun old = run("old", NOW.minus(Duration.ofDays(2)));
        registry.create(old);
        registry.update("old", r -> r.fail("boom"));

        new ReviewRetentionScheduler(registry, Clock.fixed(NOW, ZoneOffset.UTC),
                Duration.ofHours(24)).purge();

        assertEquals(0, registry.size());
    }

    private static ReviewRun run(final String id, final Instant at) {
        return ReviewRun.create(id, List.of(CodeUnit.of("a.py", "x = 1", null)),
                ReviewOptions.defaults(), Clock.fixed(at, ZoneOffset.UTC));
    }

}
