package co.fanki.codereview.review.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a finding.
 *
 * <p>The declaration order is the ranking order: {@code CRITICAL} ranks
 * first. Each severity also carries the number of points it subtracts from
 * the review score.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Severity {

    /** Must be fixed before merging. */
    CRITICAL(0, 15),

    /** Should be fixed before merging. */
    MAJOR(1, 5),

    /** Worth fixing, does not block. */
    MINOR(2, 2),

    /** Informational only. */
    INFO(3, 0);

    private final int rank;
    private final int penalty;

    Severity(final int theRank, final int thePenalty) {
        this.rank = theRank;
        this.penalty = thePenalty;
    }

    /**
     * Returns the sort rank, lower is more severe.
     *
     * @return the rank
     */
    public int rank() {
        return rank;
    }

    /**
     * Returns the points subtracted from the score per finding.
     *
     * @return the penalty
     */
    public int penalty() {
        return penalty;
    }

    /**
     * Returns the lowercase wire name.
     *
     * @return the wire name
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a severity, returning {@code MINOR} when not recognized.
     *
     * <p>Producers are external and free-form; an unknown severity must not
     * drop the finding.</p>
     *
     * @param value the raw value
     * @return the severity
     */
    @JsonCreator
    public static Severity fromString(final String value) {
        if (value == null || value.isBlank()) {
            return MINOR;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            return MINOR;
        }
    }

}
