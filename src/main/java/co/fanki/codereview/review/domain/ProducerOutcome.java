package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What one producer returned for one file, or for a whole batch once
 * aggregated.
 *
 * <p>Never changed after creation. {@link #aggregate(String, List)} builds
 * a new outcome by concatenation and leaves its inputs untouched.</p>
 *
 * @param producerName the producer that ran
 * @param findings the findings, in producer order
 * @param narrative the producer's free text reasoning
 * @param qualityScore the producer's own quality score, may be null
 * @param elapsedMillis wall time spent producing
 * @param cost the provider cost in dollars
 * @param succeeded whether the producer returned a usable result
 * @param error the failure message, null on success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProducerOutcome(
        String producerName,
        List<Finding> findings,
        String narrative,
        Double qualityScore,
        long elapsedMillis,
        double cost,
        boolean succeeded,
        String error) {

    /** Compact constructor. */
    public ProducerOutcome {
        Preconditions.requireNonBlank(producerName, "Producer name is required");
        Preconditions.requireNonNegative(cost, "Cost cannot be negative");
        findings = findings == null ? List.of() : List.copyOf(findings);
        narrative = narrative == null ? "" : narrative;
        if (!succeeded) {
            Preconditions.requireNonBlank(error,
                    "A failed outcome must carry an error");
        }
    }

    /**
     * Creates a successful outcome.
     *
     * @param producerName the producer
     * @param findings the findings
     * @param narrative the reasoning text
     * @param qualityScore the quality score, may be null
     * @param elapsedMillis the elapsed time
     * @param cost the cost
     * @return the outcome
     */
    public static ProducerOutcome succeeded(final String producerName,
            final List<Finding> findings, final String narrative,
            final Double qualityScore, final long elapsedMillis,
            final double cost) {
        return new ProducerOutcome(producerName, findings, narrative,
                qualityScore, elapsedMillis, cost, true, null);
    }

    /**
     * Creates a failed outcome. It carries no findings.
     *
     * @param producerName the producer
     * @param error what went wrong
     * @param elapsedMillis the elapsed time
     * @return the outcome
     */
    public static ProducerOutcome failed(final String producerName,
            final String error, final long elapsedMillis) {
        return new ProducerOutcome(producerName, List.of(), "", null,
                elapsedMillis, 0.0, false,
                error == null || error.isBlank() ? "unknown error" : error);
    }

    /**
     * Concatenates per-file outcomes of the same producer.
     *
     * <p>Findings keep file order, narratives are joined by blank lines,
     * times and costs are summed and the quality score is the mean of the
     * scores present. The result succeeded if any input succeeded.</p>
     *
     * @param producerName the producer
     * @param outcomes the per-file outcomes, in file order
     * @return the aggregated outcome
     */
    public static ProducerOutcome aggregate(final String producerName,
            final List<ProducerOutcome> outcomes) {
        Preconditions.requireNonNull(outcomes, "Outcomes are required");
        final List<Finding> all = new ArrayList<>();
        final List<String> narratives = new ArrayList<>();
        long elapsed = 0;
        double cost = 0;
        double scoreSum = 0;
        int scored = 0;
        boolean anySucceeded = false;
        String lastError = null;
        for (ProducerOutcome outcome : outcomes) {
            all.addAll(outcome.findings());
            if (!outcome.narrative().isBlank()) {
                narratives.add(outcome.narrative());
            }
            elapsed += outcome.elapsedMillis();
            cost += outcome.cost();
            if (outcome.qualityScore() != null) {
                scoreSum += outcome.qualityScore();
                scored++;
            }
            anySucceeded |= outcome.succeeded();
            if (!outcome.succeeded()) {
                lastError = outcome.error();
            }
        }
        return new ProducerOutcome(producerName, all,
                narratives.stream().collect(Collectors.joining("\n\n")),
                scored == 0 ? null : scoreSum / scored,
                elapsed, cost, anySucceeded,
                anySucceeded ? null : lastError == null ? "no outcomes" : lastError);
    }

}
