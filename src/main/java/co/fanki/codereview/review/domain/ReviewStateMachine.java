package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes all valid review stage transitions.
 *
 * <p>Stages only move forward and none may be skipped on success. Every
 * non-terminal stage may fail.</p>
 *
 * <pre>
 *   PENDING       → PREPROCESSING, FAILED
 *   PREPROCESSING → ENRICHING, FAILED
 *   ENRICHING     → PRODUCING, FAILED
 *   PRODUCING     → CONSOLIDATING, FAILED
 *   CONSOLIDATING → COMPLETE, FAILED
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReviewStateMachine {

    /** Error code for a rejected transition. */
    public static final String INVALID_TRANSITION = "REVIEW_INVALID_TRANSITION";

    private static final Map<ReviewStage, Set<ReviewStage>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(ReviewStage.class);
        TRANSITIONS.put(ReviewStage.PENDING,       EnumSet.of(ReviewStage.PREPROCESSING, ReviewStage.FAILED));
        TRANSITIONS.put(ReviewStage.PREPROCESSING, EnumSet.of(ReviewStage.ENRICHING, ReviewStage.FAILED));
        TRANSITIONS.put(ReviewStage.ENRICHING,     EnumSet.of(ReviewStage.PRODUCING, ReviewStage.FAILED));
        TRANSITIONS.put(ReviewStage.PRODUCING,     EnumSet.of(ReviewStage.CONSOLIDATING, ReviewStage.FAILED));
        TRANSITIONS.put(ReviewStage.CONSOLIDATING, EnumSet.of(ReviewStage.COMPLETE, ReviewStage.FAILED));
    }

    private ReviewStateMachine() {
    }

    /**
     * Validates a stage transition and returns the target stage.
     *
     * @param from the current stage
     * @param to the desired stage
     * @return {@code to} when the transition is valid
     * @throws DomainException with code {@code REVIEW_INVALID_TRANSITION}
     *                         when the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static ReviewStage transition(final ReviewStage from,
            final ReviewStage to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        final Set<ReviewStage> allowed = TRANSITIONS.getOrDefault(from,
                EnumSet.noneOf(ReviewStage.class));
        if (!allowed.contains(to)) {
            throw new DomainException(
                    "Invalid transition: " + from + " → " + to,
                    INVALID_TRANSITION);
        }
        return to;
    }

}
