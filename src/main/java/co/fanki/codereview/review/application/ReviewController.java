package co.fanki.codereview.review.application;

import co.fanki.codereview.review.domain.ReviewStatus;
import co.fanki.codereview.review.domain.ReviewValidationException;
import co.fanki.codereview.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * REST controller for code reviews.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/reviews")
@Tag(name = "Code Review", description = "Submit code for multi-producer review and poll the results")
public class ReviewController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReviewController.class);

    private static final Duration MIN_STREAM_INTERVAL = Duration.ofSeconds(1);

    private final ReviewService reviewService;
    private final ScheduledExecutorService streamScheduler;
    private final Duration streamInterval;
    private final Duration streamTimeout;

    /**
     * Creates a new ReviewController.
     *
     * @param theReviewService the review service
     * @param theStreamScheduler the scheduler pushing stream snapshots
     * @param theStreamInterval the interval between snapshots, at least 1s
     * @param theStreamTimeout how long a stream stays open
     */
    public ReviewController(final ReviewService theReviewService,
            @Qualifier("streamScheduler")
            final ScheduledExecutorService theStreamScheduler,
            @Value("${review.stream.interval:2s}") final Duration theStreamInterval,
            @Value("${review.stream.timeout:10m}") final Duration theStreamTimeout) {
        this.reviewService = theReviewService;
        this.streamScheduler = theStreamScheduler;
        this.streamInterval = theStreamInterval.compareTo(MIN_STREAM_INTERVAL) < 0
                ? MIN_STREAM_INTERVAL : theStreamInterval;
        this.streamTimeout = theStreamTimeout;
    }

    /**
     * Submits files for review.
     *
     * @param request the files and options
     * @return 202 with the review id
     */
    @Operation(
            summary = "Submit a review",
            description = "Validates the files and starts the review in the background. "
                    + "Poll GET /api/reviews/{id} or stream /api/reviews/{id}/stream for the result."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Review accepted",
                    content = @Content(schema = @Schema(implementation = SubmitResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid batch"),
            @ApiResponse(responseCode = "500", description = "Submission failed")
    })
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody final ReviewRequest request) {
        LOG.info("Received review request with {} files",
                request.files() == null ? 0 : request.files().size());
        try {
            final ReviewStatus status = reviewService.submit(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(SubmitResponse.of(status));
        } catch (final ReviewValidationException e) {
            LOG.warn("Rejected review request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponse.of(e));
        } catch (final Exception e) {
            LOG.error("Unexpected error submitting review", e);
            return ResponseEntity.internalServerError()
                    .body(ErrorResponse.internal(e));
        }
    }

    /**
     * Runs a review and waits for its terminal status.
     *
     * @param request the files and options
     * @return the terminal status
     */
    @Operation(summary = "Run a review synchronously")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review finished",
                    content = @Content(schema = @Schema(implementation = ReviewStatus.class))),
            @ApiResponse(responseCode = "400", description = "Invalid batch")
    })
    @PostMapping("/sync")
    public ResponseEntity<?> review(@RequestBody final ReviewRequest request) {
        try {
            return ResponseEntity.ok(reviewService.review(request));
        } catch (final ReviewValidationException e) {
            LOG.warn("Rejected review request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponse.of(e));
        } catch (final Exception e) {
            LOG.error("Unexpected error running review", e);
            return ResponseEntity.internalServerError()
                    .body(ErrorResponse.internal(e));
        }
    }

    /**
     * Returns the status of a review.
     *
     * @param reviewId the review id
     * @return the status, or 404
     */
    @Operation(summary = "Get review status",
            description = "Returns the stage, the progress and, once complete, the report.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review found",
                    content = @Content(schema = @Schema(implementation = ReviewStatus.class))),
            @ApiResponse(responseCode = "404", description = "Unknown review")
    })
    @GetMapping("/{id}")
    public ResponseEntity<ReviewStatus> status(
            @PathVariable("id") final String reviewId) {
        return reviewService.status(reviewId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Streams status snapshots until the review is terminal.
     *
     * @param reviewId the review id
     * @return the event stream
     */
    @Operation(summary = "Stream review status",
            description = "Server-sent events with a status snapshot per interval, "
                    + "closed once the review completes or fails.")
    @GetMapping("/{id}/stream")
    public SseEmitter stream(@PathVariable("id") final String reviewId) {
        final SseEmitter emitter = new SseEmitter(streamTimeout.toMillis());
        final AtomicReference<ScheduledFuture<?>> poller = new AtomicReference<>();

        emitter.onCompletion(() -> cancel(poller));
        emitter.onTimeout(() -> {
            cancel(poller);
            emitter.complete();
        });
        emitter.onError(e -> cancel(poller));

        // First snapshot goes out now; the poller only exists for open streams.
        if (push(emitter, reviewId)) {
            final long interval = streamInterval.toMillis();
            poller.set(streamScheduler.scheduleAtFixedRate(() -> {
                if (!push(emitter, reviewId)) {
                    cancel(poller);
                }
            }, interval, interval, TimeUnit.MILLISECONDS));
        }
        return emitter;
    }

    /**
     * Sends one status snapshot.
     *
     * @return true while the stream should keep going
     */
    private boolean push(final SseEmitter emitter, final String reviewId) {
        try {
            final Optional<ReviewStatus> status = reviewService.status(reviewId);
            if (status.isEmpty()) {
                emitter.send(SseEmitter.event().name("error")
                        .data(Map.of("error", "Review not found: " + reviewId)));
                emitter.complete();
                return false;
            }
            emitter.send(SseEmitter.event().name("status").data(status.get()));
            if (status.get().terminal()) {
                emitter.complete();
                return false;
            }
            return true;
        } catch (final IOException | IllegalStateException e) {
            LOG.debug("Stream for review {} closed: {}", reviewId,
                    e.getMessage());
            return false;
        }
    }

    /**
     * Deletes a review, cancelling it when still running.
     *
     * @param reviewId the review id
     * @return {@code {deleted: true}}, or 404
     */
    @Operation(summary = "Delete a review")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review deleted"),
            @ApiResponse(responseCode = "404", description = "Unknown review")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<DeleteResponse> delete(
            @PathVariable("id") final String reviewId) {
        if (reviewService.delete(reviewId)) {
            return ResponseEntity.ok(new DeleteResponse(true));
        }
        return ResponseEntity.notFound().build();
    }

    /**
     * Reviews a GitHub pull request.
     *
     * @param request the pull request coordinates
     * @return 202 with the review id
     */
    @Operation(summary = "Review a GitHub pull request",
            description = "Fetches the changed files, reviews them in the background and "
                    + "optionally posts the summary as a pull request comment.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Review accepted",
                    content = @Content(schema = @Schema(implementation = SubmitResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "502", description = "GitHub call failed")
    })
    @PostMapping("/github-pr")
    public ResponseEntity<?> reviewPullRequest(
            @RequestBody final PullRequestReviewRequest request) {
        LOG.info("Received pull request review for {}#{}",
                request.repository(), request.pullNumber());
        try {
            final ReviewStatus status = reviewService.submitPullRequest(
                    request.repository(),
                    request.pullNumber() == null ? 0 : request.pullNumber(),
                    Boolean.TRUE.equals(request.postComments()),
                    request.options());
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(SubmitResponse.of(status));
        } catch (final ReviewValidationException | IllegalArgumentException e) {
            LOG.warn("Rejected pull request review: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(
                    e.getMessage(), ReviewValidationException.CODE));
        } catch (final DomainException e) {
            LOG.error("Pull request review failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ErrorResponse.of(e));
        } catch (final Exception e) {
            LOG.error("Unexpected error reviewing pull request", e);
            return ResponseEntity.internalServerError()
                    .body(ErrorResponse.internal(e));
        }
    }

    /**
     * Returns the spend and cache counters.
     *
     * @return the stats
     */
    @Operation(summary = "Get review statistics")
    @GetMapping("/stats")
    public ResponseEntity<ReviewService.ReviewStats> stats() {
        return ResponseEntity.ok(reviewService.stats());
    }

    private static void cancel(final AtomicReference<ScheduledFuture<?>> poller) {
        final ScheduledFuture<?> future = poller.get();
        if (future != null) {
            future.cancel(false);
        }
    }

    /**
     * Response of an accepted submission.
     *
     * @param reviewId the review id
     * @param stage the stage, pending
     */
    public record SubmitResponse(String reviewId, String stage) {

        static SubmitResponse of(final ReviewStatus status) {
            return new SubmitResponse(status.reviewId(), status.stage().wireName());
        }
    }

    /**
     * Error body.
     *
     * @param error the message
     * @param errorCode the domain error code
     */
    public record ErrorResponse(String error, String errorCode) {

        static ErrorResponse of(final DomainException e) {
            return new ErrorResponse(e.getMessage(), e.getErrorCode());
        }

        static ErrorResponse internal(final Exception e) {
            return new ErrorResponse("Internal error: " + e.getMessage(),
                    DomainException.DEFAULT_CODE);
        }
    }

    /**
     * Response of a delete.
     */
    public record DeleteResponse(boolean deleted) {}

    /**
     * Request to review a pull request.
     *
     * @param repository the repository, as owner/name
     * @param pullNumber the pull request number
     * @param postComments whether to post the summary comment
     * @param options the review toggles
     */
    public record PullRequestReviewRequest(
            String repository,
            Integer pullNumber,
            Boolean postComments,
            Map<String, Object> options
    ) {}

}
