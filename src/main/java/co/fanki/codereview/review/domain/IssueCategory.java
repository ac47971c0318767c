package co.fanki.codereview.review.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a finding.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum IssueCategory {

    BUG,

    SECURITY,

    PERFORMANCE,

    STYLE,

    DOCUMENTATION,

    BEST_PRACTICE;

    /**
     * Returns the lowercase wire name, e.g. {@code best_practice}.
     *
     * @return the wire name
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a category, returning {@code STYLE} when not recognized.
     *
     * <p>Accepts hyphenated and spaced variants such as
     * {@code "best-practice"}.</p>
     *
     * @param value the raw value
     * @return the category
     */
    @JsonCreator
    public static IssueCategory fromString(final String value) {
        if (value == null || value.isBlank()) {
            return STYLE;
        }
        final String normalized = value.trim()
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (final IllegalArgumentException e) {
            return STYLE;
        }
    }

}
