package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ReviewRun}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReviewRunTest {

    private static final Clock CLOCK = Clock.fixed(
            Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void whenCreating_givenNewRun_shouldBePendingAtZero() {
        final ReviewStatus status = newRun().snapshot();

        assertEquals(ReviewStage.PENDING, status.stage());
        assertEquals(0, status.progress());
        assertNull(status.result());
        assertEquals(CLOCK.instant(), status.createdAt());
    }

    @Test
    void whenCreating_givenNoUnits_shouldThrowException() {
        assertThrows(IllegalArgumentException.class, () -> ReviewRun.create(
                List.of(), ReviewOptions.defaults()));
    }

    @Test
    void whenProducing_givenPairsFinished_shouldAdvanceProgressProportionally() {
        final ReviewRun run = runAt(ReviewStage.PRODUCING);
        run.planPairs(4);

        assertEquals(40, run.snapshot().progress());
        run.pairFinished();
        assertEquals(52, run.snapshot().progress());
        run.pairFinished();
        run.pairFinished();
        run.pairFinished();
        assertEquals(90, run.snapshot().progress());
    }

    @Test
    void whenCompleting_givenConsolidation_shouldExposeReport() {
        final ReviewRun run = runAt(ReviewStage.CONSOLIDATING);
        run.recordOutcome(ProducerOutcome.succeeded("analyzer", List.of(),
                "", null, 10, 0.5));
        final Consolidation consolidation = new Consolidator().consolidate(
                run.orderedOutcomes());

        run.complete(consolidation);

        final ReviewStatus status = run.snapshot();
        assertEquals(ReviewStage.COMPLETE, status.stage());
        assertEquals(100, status.progress());
        assertTrue(status.terminal());
        assertNotNull(status.completedAt());
        assertEquals(List.of("a.py"), status.result().files());
        assertEquals(List.of("analyzer"), status.result().metadata().producers());
        assertEquals(0.5, status.result().statistics().totalCost());
    }

    @Test
    void whenFailing_givenProducingStage_shouldKeepLastProgress() {
        final ReviewRun run = runAt(ReviewStage.PRODUCING);
        run.planPairs(2);
        run.pairFinished();

        run.fail("all producers failed");

        final ReviewStatus status = run.snapshot();
        assertEquals(ReviewStage.FAILED, status.stage());
        assertEquals(65, status.progress());
        assertEquals("all producers failed", status.error());
        assertNull(status.result());
    }

    @Test
    void whenMutating_givenTerminalRun_shouldThrowTerminalError() {
        final ReviewRun run = runAt(ReviewStage.ENRICHING);
        run.fail("boom");

        final DomainException e = assertThrows(DomainException.class,
                () -> run.recordFailure("a.py", "analyzer", "late"));
        assertEquals(ReviewRun.TERMINAL, e.getErrorCode());
        assertThrows(DomainException.class,
                () -> run.moveTo(ReviewStage.PRODUCING));
    }

    private static ReviewRun newRun() {
        return ReviewRun.create("review-1",
                List.of(CodeUnit.of("a.py", "print(1)", null)),
                ReviewOptions.defaults(), CLOCK);
    }

    private static ReviewRun runAt(final ReviewStage target) {
        final ReviewRun run = newRun();
        for (ReviewStage stage : List.of(ReviewStage.PREPROCESSING,
                ReviewStage.ENRICHING, ReviewStage.PRODUCING,
                ReviewStage.CONSOLIDATING)) {
            run.moveTo(stage);
            if (stage == target) {
                break;
            }
        }
        return run;
    }

}
