package co.fanki.codereview.context.domain;

import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Language agnostic line checks.
 *
 * <p>Flags overlong lines, tab indentation, trailing whitespace, pending
 * TODO / FIXME markers, empty catch or except blocks and string literals
 * that look like hard-coded credentials. Each issue is reported once per
 * line and rule.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LineMetricsStaticAnalyzer implements StaticAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            LineMetricsStaticAnalyzer.class);

    private static final String NAME = "line-metrics";

    private static final Pattern TODO = Pattern.compile(
            "\\b(TODO|FIXME|XXX)\\b");

    private static final Pattern EMPTY_CATCH = Pattern.compile(
            "catch\\s*\\([^)]*\\)\\s*\\{\\s*}|except[^:]*:\\s*pass\\b");

    private static final Pattern SECRET = Pattern.compile(
            "(?i)(password|passwd|secret|api[_-]?key|token)\\s*[:=]\\s*[\"'][^\"']{6,}[\"']");

    private final int maxLineLength;

    /**
     * Creates the analyzer.
     *
     * @param theMaxLineLength the longest accepted line
     */
    public LineMetricsStaticAnalyzer(final int theMaxLineLength) {
        this.maxLineLength = Preconditions.requirePositive(theMaxLineLength,
                "Max line length must be positive");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StaticAnalysisResult analyze(final CodeUnit unit) {
        Preconditions.requireNonNull(unit, "Code unit is required");
        final List<StaticAnalysisResult.StaticIssue> issues = new ArrayList<>();
        final String[] lines = unit.content().split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            final String line = lines[i].endsWith("\r")
                    ? lines[i].substring(0, lines[i].length() - 1)
                    : lines[i];
            final int number = i + 1;
            if (line.length() > maxLineLength) {
                issues.add(issue(number, "line-too-long", "Line has "
                        + line.length() + " characters, limit is "
                        + maxLineLength));
            }
            if (line.startsWith("\t")) {
                issues.add(issue(number, "tab-indent",
                        "Indentation uses tabs"));
            }
            if (!line.isEmpty() && Character.isWhitespace(
                    line.charAt(line.length() - 1))) {
                issues.add(issue(number, "trailing-whitespace",
                        "Trailing whitespace"));
            }
            if (TODO.matcher(line).find()) {
                issues.add(issue(number, "pending-marker",
                        "Pending TODO/FIXME marker"));
            }
            if (EMPTY_CATCH.matcher(line).find()) {
                issues.add(issue(number, "empty-handler",
                        "Exception handler swallows the error"));
            }
            if (SECRET.matcher(line).find()) {
                issues.add(issue(number, "hardcoded-secret",
                        "Possible hard-coded credential"));
            }
        }
        LOG.debug("{} found {} issues in {}", NAME, issues.size(), unit.path());
        return StaticAnalysisResult.of(NAME, issues);
    }

    private static StaticAnalysisResult.StaticIssue issue(final int line,
            final String rule, final String message) {
        return new StaticAnalysisResult.StaticIssue(line, rule, message);
    }

}
