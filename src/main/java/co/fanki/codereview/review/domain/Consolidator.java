package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges producer outcomes into one ranked report.
 *
 * <p>The result depends only on the findings' structural fields (line,
 * category, title, severity, confidence). Findings that share the line,
 * the category and the first {@value #TITLE_KEY_WIDTH} characters of the
 * title are treated as the same issue; the most confident one is kept and
 * carries the union of the group's sources.</p>
 *
 * <p>Stateless and thread safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Consolidator {

    /** Title prefix length used as part of the identity of an issue. */
    public static final int TITLE_KEY_WIDTH = 50;

    private static final int PERFECT_SCORE = 100;

    private static final Comparator<Finding> RANKING = Comparator
            .comparingInt((Finding f) -> f.severity().rank())
            .thenComparing(Comparator.comparingDouble(Finding::confidence)
                    .reversed());

    /**
     * Consolidates the given outcomes. Failed outcomes contribute nothing.
     *
     * @param outcomes the aggregated producer outcomes, in producer order
     * @return the consolidation, never null
     */
    public Consolidation consolidate(final Collection<ProducerOutcome> outcomes) {
        Preconditions.requireNonNull(outcomes, "Outcomes are required");

        final List<Finding> all = new ArrayList<>();
        double totalCost = 0;
        for (ProducerOutcome outcome : outcomes) {
            totalCost += outcome.cost();
            if (outcome.succeeded()) {
                all.addAll(outcome.findings());
            }
        }

        final List<Finding> ranked = deduplicate(all);
        ranked.sort(RANKING);

        final Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (Finding finding : ranked) {
            counts.merge(finding.severity(), 1L, Long::sum);
        }

        final int score = score(counts);
        final long critical = counts.get(Severity.CRITICAL);
        final long major = counts.get(Severity.MAJOR);

        final Map<String, Long> bySeverity = new TreeMap<>();
        counts.forEach((severity, count) ->
                bySeverity.put(severity.wireName(), count));

        return new Consolidation(ranked, score,
                Recommendation.of(critical, score),
                summary(critical, major), bySeverity, totalCost);
    }

    /**
     * Groups findings by issue identity, preserving first-seen order.
     *
     * @param findings the flattened findings
     * @return one finding per group, mutable
     */
    List<Finding> deduplicate(final List<Finding> findings) {
        final Map<IssueKey, List<Finding>> groups = new LinkedHashMap<>();
        for (Finding finding : findings) {
            groups.computeIfAbsent(IssueKey.of(finding),
                    k -> new ArrayList<>()).add(finding);
        }
        final List<Finding> result = new ArrayList<>(groups.size());
        for (List<Finding> group : groups.values()) {
            if (group.size() == 1) {
                result.add(group.get(0));
                continue;
            }
            Finding best = group.get(0);
            final TreeSet<String> sources = new TreeSet<>();
            for (Finding candidate : group) {
                sources.addAll(candidate.sources());
                if (candidate.confidence() > best.confidence()) {
                    best = candidate;
                }
            }
            result.add(best.withMerge(best.confidence(), sources));
        }
        return result;
    }

    /**
     * Computes the score from the severity counts.
     *
     * @param counts findings per severity
     * @return the score clamped to [0, 100]
     */
    static int score(final Map<Severity, Long> counts) {
        long score = PERFECT_SCORE;
        for (Map.Entry<Severity, Long> entry : counts.entrySet()) {
            score -= entry.getKey().penalty() * entry.getValue();
        }
        return (int) Math.max(0, Math.min(PERFECT_SCORE, score));
    }

    static String summary(final long critical, final long major) {
        if (critical > 0) {
            return "Code review found " + critical + " critical and " + major
                    + " major issues that must be addressed before merging.";
        }
        if (major > 3) {
            return "Code review found " + major
                    + " major issues. Please address these before merging.";
        }
        if (major > 0) {
            return "Code is generally good with " + major
                    + " major issues to consider.";
        }
        return "Code looks great! Only minor suggestions for improvement.";
    }

    /** Identity of an issue across producers. */
    private record IssueKey(int lineStart, IssueCategory category,
            String titlePrefix) {

        static IssueKey of(final Finding finding) {
            final String title = finding.title();
            // Width in code points, so surrogate pairs count once.
            final int width = Math.min(TITLE_KEY_WIDTH,
                    title.codePointCount(0, title.length()));
            return new IssueKey(finding.lineStart(), finding.category(),
                    title.substring(0, title.offsetByCodePoints(0, width)));
        }
    }

}
