package co.fanki.codereview.review.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Verdict derived from the consolidated findings.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Recommendation {

    APPROVE,

    REQUEST_CHANGES,

    REJECT;

    /**
     * Derives the verdict from the critical count and the score.
     *
     * @param criticalCount the number of critical findings
     * @param score the review score in [0, 100]
     * @return reject on any critical or a score under 50, request changes
     *         under 70, approve otherwise
     */
    public static Recommendation of(final long criticalCount, final int score) {
        if (criticalCount > 0 || score < 50) {
            return REJECT;
        }
        if (score < 70) {
            return REQUEST_CHANGES;
        }
        return APPROVE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

}
