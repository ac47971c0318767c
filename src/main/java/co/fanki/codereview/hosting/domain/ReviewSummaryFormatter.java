package co.fanki.codereview.hosting.domain;

import co.fanki.codereview.review.domain.ReviewReport;
import co.fanki.codereview.review.domain.Severity;

import java.util.Locale;

/**
 * Renders a review report as a markdown pull request comment.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReviewSummaryFormatter {

    private ReviewSummaryFormatter() {
    }

    /**
     * Formats the summary comment.
     *
     * @param report the completed report
     * @return the markdown body
     */
    public static String format(final ReviewReport report) {
        final StringBuilder body = new StringBuilder();
        body.append("## Code Review Summary\n\n")
                .append(report.summary()).append("\n\n")
                .append("**Score:** ").append(report.score()).append("/100\n\n")
                .append("### Issues Found\n");
        for (Severity severity : Severity.values()) {
            final Long count = report.statistics().bySeverity()
                    .get(severity.wireName());
            body.append("- ").append(capitalize(severity.wireName()))
                    .append(": ").append(count == null ? 0 : count)
                    .append('\n');
        }
        body.append("\n**Recommendation:** ")
                .append(report.recommendation().wireName()
                        .toUpperCase(Locale.ROOT))
                .append('\n');
        return body.toString();
    }

    private static String capitalize(final String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

}
