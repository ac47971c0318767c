package co.fanki.codereview.review.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Stages of a review run, in pipeline order.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ReviewStage {

    /**
     * Accepted, not started yet.
     */
    PENDING(0),

    /**
     * Running static checks per file.
     */
    PREPROCESSING(10),

    /**
     * Querying the knowledge store per file.
     */
    ENRICHING(25),

    /**
     * Running producers per file.
     */
    PRODUCING(40),

    /**
     * Merging producer outcomes into the report.
     */
    CONSOLIDATING(90),

    /**
     * Report is available.
     */
    COMPLETE(100),

    /**
     * The run stopped with an error.
     */
    FAILED(-1);

    private final int progress;

    ReviewStage(final int theProgress) {
        this.progress = theProgress;
    }

    /**
     * Returns the progress percentage reported when the stage starts.
     *
     * <p>{@code FAILED} has no progress of its own, the run keeps the value
     * it had when it failed.</p>
     *
     * @return the progress, or -1 for {@code FAILED}
     */
    public int progress() {
        return progress;
    }

    /**
     * Checks if no further transition is possible.
     *
     * @return true for complete and failed
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

}
