package co.fanki.codereview.review.domain;

import java.util.List;
import java.util.Map;

/**
 * The merged verdict of a review.
 *
 * @param findings deduplicated findings, most severe first
 * @param score the score in [0, 100]
 * @param recommendation the verdict
 * @param summary one templated sentence
 * @param bySeverity finding counts per severity wire name, all severities present
 * @param totalCost the summed producer cost
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Consolidation(
        List<Finding> findings,
        int score,
        Recommendation recommendation,
        String summary,
        Map<String, Long> bySeverity,
        double totalCost) {

    /** Compact constructor. */
    public Consolidation {
        findings = List.copyOf(findings);
        bySeverity = Map.copyOf(bySeverity);
    }

}
