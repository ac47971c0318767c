package co.fanki.codereview.review.application;

import co.fanki.codereview.cache.application.CacheGate;
import co.fanki.codereview.cache.domain.CacheStats;
import co.fanki.codereview.hosting.domain.HostingException;
import co.fanki.codereview.hosting.domain.PullRequestFile;
import co.fanki.codereview.hosting.domain.ReviewSummaryFormatter;
import co.fanki.codereview.hosting.domain.SourceHostingClient;
import co.fanki.codereview.provider.domain.CostLedger;
import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.ReviewOptions;
import co.fanki.codereview.review.domain.ReviewRun;
import co.fanki.codereview.review.domain.ReviewStatus;
import co.fanki.codereview.review.domain.ReviewValidationException;
import co.fanki.codereview.shared.DomainException;
import co.fanki.codereview.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Application service behind the HTTP and MCP surfaces.
 *
 * <p>Submissions are validated synchronously; the review itself runs on
 * the review executor and is observed through the registry.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReviewService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReviewService.class);

    /** Error code raised when a pull request review is requested but no
     * hosting client is configured. */
    public static final String HOSTING_DISABLED = "HOSTING_DISABLED";

    private final ReviewRegistry registry;
    private final ReviewPipeline pipeline;
    private final ReviewRequestValidator validator;
    private final ExecutorService reviewExecutor;
    private final CostLedger costLedger;
    private final CacheGate cacheGate;
    private final SourceHostingClient hostingClient;

    /**
     * Creates a new ReviewService.
     *
     * @param theRegistry the review registry
     * @param thePipeline the pipeline
     * @param theValidator the request validator
     * @param theReviewExecutor the pool running whole reviews
     * @param theCostLedger the process-wide spend ledger
     * @param theCacheGate the cache gate
     * @param theHostingClient the source hosting client, null when disabled
     */
    public ReviewService(final ReviewRegistry theRegistry,
            final ReviewPipeline thePipeline,
            final ReviewRequestValidator theValidator,
            final ExecutorService theReviewExecutor,
            final CostLedger theCostLedger,
            final CacheGate theCacheGate,
            final SourceHostingClient theHostingClient) {
        this.registry = Preconditions.requireNonNull(theRegistry,
                "Registry is required");
        this.pipeline = Preconditions.requireNonNull(thePipeline,
                "Pipeline is required");
        this.validator = Preconditions.requireNonNull(theValidator,
                "Validator is required");
        this.reviewExecutor = Preconditions.requireNonNull(theReviewExecutor,
                "Review executor is required");
        this.costLedger = Preconditions.requireNonNull(theCostLedger,
                "Cost ledger is required");
        this.cacheGate = Preconditions.requireNonNull(theCacheGate,
                "Cache gate is required");
        this.hostingClient = theHostingClient;
    }

    /**
     * Registers a review and starts it in the background.
     *
     * @param request the batch
     * @return the pending status
     * @throws ReviewValidationException if the batch is invalid
     */
    public ReviewStatus submit(final ReviewRequest request) {
        final ReviewRun run = register(request);
        start(run, () -> pipeline.run(run));
        return run.snapshot();
    }

    /**
     * Runs a review on the calling thread.
     *
     * @param request the batch
     * @return the terminal status
     * @throws ReviewValidationException if the batch is invalid
     */
    public ReviewStatus review(final ReviewRequest request) {
        final ReviewRun run = register(request);
        return pipeline.run(run);
    }

    public Optional<ReviewStatus> status(final String reviewId) {
        return registry.get(reviewId);
    }

    /**
     * Deletes a review, cancelling it when still running.
     *
     * @param reviewId the review id
     * @return false when no such review exists
     */
    public boolean delete(final String reviewId) {
        return registry.delete(reviewId);
    }

    /**
     * Reviews the files of a pull request in the background.
     *
     * <p>The files are fetched before returning. Oversized files are
     * skipped and the batch is truncated to the file limit. When
     * {@code postComments} is set the summary is posted on the pull request
     * once the review completes.</p>
     *
     * @param repository the repository, as {@code owner/name}
     * @param number the pull request number
     * @param postComments whether to post the summary comment
     * @param options the review toggles, may be null
     * @return the pending status
     */
    public ReviewStatus submitPullRequest(final String repository,
            final int number, final boolean postComments,
            final Map<String, Object> options) {
        if (hostingClient == null) {
            throw new DomainException("Source hosting is not enabled",
                    HOSTING_DISABLED);
        }
        Preconditions.require(number > 0, "Pull request number must be positive");

        final List<ReviewRequest.FileInput> files = new ArrayList<>();
        for (PullRequestFile file : hostingClient.fetchPullRequestFiles(
                repository, number)) {
            if (files.size() == validator.maxFiles()) {
                LOG.warn("Pull request {}#{} has more than {} files, "
                        + "reviewing the first ones", repository, number,
                        validator.maxFiles());
                break;
            }
            if (file.content() == null || file.content().isBlank()) {
                continue;
            }
            if (file.content().getBytes(StandardCharsets.UTF_8).length
                    > validator.maxFileSize()) {
                LOG.warn("Skipping oversized file {} in {}#{}", file.path(),
                        repository, number);
                continue;
            }
            files.add(new ReviewRequest.FileInput(file.path(), file.content(),
                    file.language()));
        }
        if (files.isEmpty()) {
            throw new ReviewValidationException("No reviewable files in "
                    + repository + "#" + number);
        }

        final ReviewRun run = register(new ReviewRequest(files, options));
        LOG.info("Reviewing {}#{} as {} ({} files)", repository, number,
                run.reviewId(), files.size());
        start(run, () -> {
            final ReviewStatus status = pipeline.run(run);
            if (postComments && status.result() != null) {
                try {
                    hostingClient.postComment(repository, number,
                            ReviewSummaryFormatter.format(status.result()));
                } catch (final HostingException e) {
                    LOG.warn("Review {} finished but the summary could not be"
                            + " posted: {}", run.reviewId(), e.getMessage());
                }
            }
        });
        return run.snapshot();
    }

    /**
     * Returns the process-wide counters.
     *
     * @return the stats
     */
    public ReviewStats stats() {
        return new ReviewStats(
                costLedger.totalCost(),
                costLedger.requestCount(),
                costLedger.failureCount(),
                costLedger.costByProvider(),
                cacheGate.enabled() ? cacheGate.stats() : null,
                cacheGate.sharedComputations(),
                registry.size());
    }

    private ReviewRun register(final ReviewRequest request) {
        final List<CodeUnit> units = validator.validate(request);
        final ReviewRun run = ReviewRun.create(units,
                ReviewOptions.fromMap(request.options()));
        registry.create(run);
        return run;
    }

    private void start(final ReviewRun run, final Runnable task) {
        try {
            reviewExecutor.execute(task);
        } catch (final RejectedExecutionException e) {
            LOG.error("Review {} rejected by the review executor", run.reviewId(), e);
            registry.update(run.reviewId(), r -> r.fail("review executor unavailable"));
        }
    }

    /**
     * Process-wide counters.
     *
     * @param totalCost the provider spend since start
     * @param requestCount successful provider calls
     * @param failureCount failed provider calls
     * @param costByProvider spend per provider
     * @param cache the result store counters, null when unavailable
     * @param sharedComputations lookups that joined an in-flight computation
     * @param reviews the reviews held by the registry
     */
    public record ReviewStats(
            double totalCost,
            long requestCount,
            long failureCount,
            Map<String, Double> costByProvider,
            CacheStats cache,
            long sharedComputations,
            int reviews) {}

}
