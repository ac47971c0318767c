package co.fanki.codereview.review.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final report of a completed review, as returned to callers.
 *
 * @param reviewId the review id
 * @param files the reviewed paths
 * @param summary the templated summary
 * @param score the score
 * @param recommendation the verdict
 * @param statistics the counts and cost
 * @param issues the consolidated findings
 * @param metadata timing and producer information
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReviewReport(
        String reviewId,
        List<String> files,
        String summary,
        int score,
        Recommendation recommendation,
        Statistics statistics,
        List<Finding> issues,
        Metadata metadata) {

    /**
     * Counts and cost of a report.
     *
     * @param totalIssues the number of consolidated findings
     * @param bySeverity counts per severity
     * @param totalCost the summed provider cost
     */
    public record Statistics(int totalIssues, Map<String, Long> bySeverity,
            double totalCost) {
    }

    /**
     * Report timing and the producers that contributed.
     *
     * @param createdAt when the review was submitted
     * @param completedAt when it completed
     * @param producers the producers that succeeded
     */
    public record Metadata(Instant createdAt, Instant completedAt,
            List<String> producers) {
    }

}
