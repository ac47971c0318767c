package co.fanki.codereview.context.domain;

import java.util.List;

/**
 * Output of the static checks for one file.
 *
 * @param tool the analyzer that produced it
 * @param issues the raw issues
 * @param succeeded whether the analyzer ran
 * @param error the failure message when it did not
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StaticAnalysisResult(
        String tool,
        List<StaticIssue> issues,
        boolean succeeded,
        String error) {

    /** Compact constructor. */
    public StaticAnalysisResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * Creates a successful result.
     *
     * @param tool the analyzer name
     * @param issues the issues found
     * @return the result
     */
    public static StaticAnalysisResult of(final String tool,
            final List<StaticIssue> issues) {
        return new StaticAnalysisResult(tool, issues, true, null);
    }

    /**
     * Creates a failed result with no issues.
     *
     * @param tool the analyzer name
     * @param error what went wrong
     * @return the result
     */
    public static StaticAnalysisResult failed(final String tool,
            final String error) {
        return new StaticAnalysisResult(tool, List.of(), false, error);
    }

    /**
     * One raw issue reported by a static check.
     *
     * @param line the line, 1 based
     * @param rule the rule id
     * @param message the message
     */
    public record StaticIssue(int line, String rule, String message) {
    }

}
