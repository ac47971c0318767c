package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link ReviewStateMachine}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReviewStateMachineTest {

    @Test
    void whenTransitioning_givenForwardSteps_shouldFollowPipelineOrder() {
        assertEquals(ReviewStage.PREPROCESSING, ReviewStateMachine.transition(
                ReviewStage.PENDING, ReviewStage.PREPROCESSING));
        assertEquals(ReviewStage.ENRICHING, ReviewStateMachine.transition(
                ReviewStage.PREPROCESSING, ReviewStage.ENRICHING));
        assertEquals(ReviewStage.PRODUCING, ReviewStateMachine.transition(
                ReviewStage.ENRICHING, ReviewStage.PRODUCING));
        assertEquals(ReviewStage.CONSOLIDATING, ReviewStateMachine.transition(
                ReviewStage.PRODUCING, ReviewStage.CONSOLIDATING));
        assertEquals(ReviewStage.COMPLETE, ReviewStateMachine.transition(
                ReviewStage.CONSOLIDATING, ReviewStage.COMPLETE));
    }

    @Test
    void whenTransitioning_givenAnyNonTerminalToFailed_shouldReturnFailed() {
        for (ReviewStage stage : ReviewStage.values()) {
            if (!stage.isTerminal()) {
                assertEquals(ReviewStage.FAILED,
                        ReviewStateMachine.transition(stage, ReviewStage.FAILED));
            }
        }
    }

    @Test
    void whenTransitioning_givenSkippedStage_shouldThrowDomainException() {
        final DomainException e = assertThrows(DomainException.class, () ->
                ReviewStateMachine.transition(ReviewStage.PENDING,
                        ReviewStage.PRODUCING));
        assertEquals(ReviewStateMachine.INVALID_TRANSITION, e.getErrorCode());
    }

    @Test
    void whenTransitioning_givenBackwardStep_shouldThrowDomainException() {
        assertThrows(DomainException.class, () -> ReviewStateMachine.transition(
                ReviewStage.PRODUCING, ReviewStage.ENRICHING));
    }

    @Test
    void whenTransitioning_givenTerminalStage_shouldThrowDomainException() {
        assertThrows(DomainException.class, () -> ReviewStateMachine.transition(
                ReviewStage.COMPLETE, ReviewStage.FAILED));
        assertThrows(DomainException.class, () -> ReviewStateMachine.transition(
                ReviewStage.FAILED, ReviewStage.PREPROCESSING));
    }

}
