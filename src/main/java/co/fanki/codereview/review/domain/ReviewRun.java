package co.fanki.codereview.review.domain;

import co.fanki.codereview.context.domain.KnowledgeSnippet;
import co.fanki.codereview.context.domain.StaticAnalysisResult;
import co.fanki.codereview.shared.DomainException;
import co.fanki.codereview.shared.Preconditions;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate root of one review: the submitted files, the options, the
 * current stage and everything the stages produced.
 *
 * <p>Only the pipeline mutates a run, and only through the registry. All
 * mutators and {@link #snapshot()} synchronize on the run, so a poller
 * never sees a half-applied stage. Once the run is complete or failed any
 * mutation is rejected with {@code REVIEW_TERMINAL}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReviewRun {

    /** Error code raised when mutating a terminal run. */
    public static final String TERMINAL = "REVIEW_TERMINAL";

    private static final int PRODUCING_SPAN = 50;

    private final String reviewId;
    private final List<CodeUnit> units;
    private final ReviewOptions options;
    private final CancellationToken cancellationToken;
    private final Clock clock;
    private final Instant createdAt;

    private ReviewStage stage;
    private int progress;
    private final Map<String, StaticAnalysisResult> staticResults =
            new LinkedHashMap<>();
    private final Map<String, List<KnowledgeSnippet>> knowledge =
            new LinkedHashMap<>();
    private final Map<String, ProducerOutcome> outcomes = new LinkedHashMap<>();
    private final List<ProducerFailure> failures = new ArrayList<>();
    private int plannedPairs;
    private int finishedPairs;
    private Consolidation consolidation;
    private String error;
    private Instant completedAt;

    private ReviewRun(final String theReviewId, final List<CodeUnit> theUnits,
            final ReviewOptions theOptions, final Clock theClock) {
        this.reviewId = Preconditions.requireNonBlank(theReviewId,
                "Review id is required");
        Preconditions.requireNonNull(theUnits, "Units are required");
        Preconditions.require(!theUnits.isEmpty(),
                "A review needs at least one file");
        this.units = List.copyOf(theUnits);
        this.options = theOptions != null ? theOptions : ReviewOptions.defaults();
        this.clock = theClock != null ? theClock : Clock.systemUTC();
        this.cancellationToken = new CancellationToken(theReviewId);
        this.createdAt = clock.instant();
        this.stage = ReviewStage.PENDING;
        this.progress = ReviewStage.PENDING.progress();
    }

    /**
     * Creates a pending run with a fresh id.
     *
     * @param units the files to review
     * @param options the toggles
     * @return the run
     */
    public static ReviewRun create(final List<CodeUnit> units,
            final ReviewOptions options) {
        return new ReviewRun(UUID.randomUUID().toString(), units, options,
                Clock.systemUTC());
    }

    /**
     * Creates a pending run with a given id and clock.
     *
     * @param reviewId the id
     * @param units the files to review
     * @param options the toggles
     * @param clock the clock for timestamps
     * @return the run
     */
    public static ReviewRun create(final String reviewId,
            final List<CodeUnit> units, final ReviewOptions options,
            final Clock clock) {
        return new ReviewRun(reviewId, units, options, clock);
    }

    public String reviewId() {
        return reviewId;
    }

    public List<CodeUnit> units() {
        return units;
    }

    public ReviewOptions options() {
        return options;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized ReviewStage stage() {
        return stage;
    }

    public synchronized Instant completedAt() {
        return completedAt;
    }

    /**
     * Moves the run to the next stage and sets the stage's progress.
     *
     * @param next the target stage
     * @throws DomainException if the run is terminal or the move is invalid
     */
    public synchronized void moveTo(final ReviewStage next) {
        ensureNotTerminal();
        stage = ReviewStateMachine.transition(stage, next);
        if (next.progress() >= 0) {
            progress = next.progress();
        }
        if (next.isTerminal()) {
            completedAt = clock.instant();
        }
    }

    /**
     * Records the static analysis result of one file.
     *
     * @param path the file path
     * @param result the result
     */
    public synchronized void recordStaticResult(final String path,
            final StaticAnalysisResult result) {
        ensureNotTerminal();
        staticResults.put(path, result);
    }

    /**
     * Records the knowledge context of one file.
     *
     * @param path the file path
     * @param snippets the snippets, possibly empty
     */
    public synchronized void recordKnowledge(final String path,
            final List<KnowledgeSnippet> snippets) {
        ensureNotTerminal();
        knowledge.put(path, List.copyOf(snippets));
    }

    public synchronized StaticAnalysisResult staticResult(final String path) {
        return staticResults.get(path);
    }

    public synchronized List<KnowledgeSnippet> knowledge(final String path) {
        return knowledge.getOrDefault(path, List.of());
    }

    /**
     * Declares how many (file, producer) pairs the produce stage runs.
     *
     * @param pairs the pair count
     */
    public synchronized void planPairs(final int pairs) {
        ensureNotTerminal();
        plannedPairs = pairs;
        finishedPairs = 0;
    }

    /**
     * Marks one pair as finished and advances progress from 40 to 90.
     */
    public synchronized void pairFinished() {
        ensureNotTerminal();
        finishedPairs++;
        if (plannedPairs > 0) {
            final int done = Math.min(finishedPairs, plannedPairs);
            progress = ReviewStage.PRODUCING.progress()
                    + PRODUCING_SPAN * done / plannedPairs;
        }
    }

    /**
     * Records one failed (file, producer) pair. Failures never reach the
     * report, they only stay on the run.
     *
     * @param path the file
     * @param producer the producer
     * @param message the error
     */
    public synchronized void recordFailure(final String path,
            final String producer, final String message) {
        ensureNotTerminal();
        failures.add(new ProducerFailure(path, producer, message));
    }

    /**
     * Records the outcome of a producer aggregated across files.
     *
     * @param outcome the aggregated outcome
     */
    public synchronized void recordOutcome(final ProducerOutcome outcome) {
        ensureNotTerminal();
        outcomes.put(outcome.producerName(), outcome);
    }

    /**
     * Returns the outcomes in the order they were recorded.
     *
     * @return the outcomes
     */
    public synchronized List<ProducerOutcome> orderedOutcomes() {
        return List.copyOf(outcomes.values());
    }

    public synchronized List<ProducerFailure> failures() {
        return List.copyOf(failures);
    }

    /**
     * Stores the consolidation and completes the run.
     *
     * @param theConsolidation the merged result
     */
    public synchronized void complete(final Consolidation theConsolidation) {
        Preconditions.requireNonNull(theConsolidation,
                "Consolidation is required");
        ensureNotTerminal();
        ReviewStateMachine.transition(stage, ReviewStage.COMPLETE);
        consolidation = theConsolidation;
        moveTo(ReviewStage.COMPLETE);
    }

    /**
     * Fails the run, keeping the progress it had.
     *
     * @param message the terminal error
     */
    public synchronized void fail(final String message) {
        ensureNotTerminal();
        error = message == null || message.isBlank() ? "review failed" : message;
        moveTo(ReviewStage.FAILED);
    }

    /**
     * Returns the summed cost of all recorded outcomes.
     *
     * @return the cost in dollars
     */
    public synchronized double totalCost() {
        return outcomes.values().stream().mapToDouble(ProducerOutcome::cost)
                .sum();
    }

    /**
     * Builds a consistent view of the run.
     *
     * @return the snapshot
     */
    public synchronized ReviewStatus snapshot() {
        ReviewReport report = null;
        if (stage == ReviewStage.COMPLETE && consolidation != null) {
            report = new ReviewReport(
                    reviewId,
                    units.stream().map(CodeUnit::path).toList(),
                    consolidation.summary(),
                    consolidation.score(),
                    consolidation.recommendation(),
                    new ReviewReport.Statistics(
                            consolidation.findings().size(),
                            consolidation.bySeverity(),
                            consolidation.totalCost()),
                    consolidation.findings(),
                    new ReviewReport.Metadata(createdAt, completedAt,
                            outcomes.values().stream()
                                    .filter(ProducerOutcome::succeeded)
                                    .map(ProducerOutcome::producerName)
                                    .toList()));
        }
        return new ReviewStatus(reviewId, stage, progress, report, error,
                createdAt, completedAt);
    }

    private void ensureNotTerminal() {
        Preconditions.requireDomain(!stage.isTerminal(), "Review " + reviewId
                + " is already " + stage.wireName(), TERMINAL);
    }

    /**
     * A (file, producer) pair that failed.
     *
     * @param path the file
     * @param producer the producer
     * @param error the error message
     */
    public record ProducerFailure(String path, String producer, String error) {
    }

}
