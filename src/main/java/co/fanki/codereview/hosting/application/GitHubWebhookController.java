package co.fanki.codereview.hosting.application;

import co.fanki.codereview.hosting.domain.WebhookSignatureVerifier;
import co.fanki.codereview.review.application.ReviewController.ErrorResponse;
import co.fanki.codereview.review.application.ReviewService;
import co.fanki.codereview.review.domain.ReviewStatus;
import co.fanki.codereview.review.domain.ReviewValidationException;
import co.fanki.codereview.shared.DomainException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Set;

/**
 * Receives GitHub webhook deliveries and reviews pull requests when they
 * are opened or receive new commits. The summary is always posted back.
 *
 * <p>Enabled with {@code github.webhook.enabled=true}; the deliveries must
 * be signed with {@code github.webhook.secret}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/webhooks")
@ConditionalOnProperty(name = "github.webhook.enabled", havingValue = "true")
@Tag(name = "Webhooks", description = "Source hosting webhook receivers")
public class GitHubWebhookController {

    private static final Logger LOG = LoggerFactory.getLogger(
            GitHubWebhookController.class);

    /** Error code of a delivery with a missing or wrong signature. */
    public static final String UNAUTHORIZED = "WEBHOOK_UNAUTHORIZED";

    private static final Set<String> REVIEWED_ACTIONS =
            Set.of("opened", "synchronize");

    private final ReviewService reviewService;
    private final ObjectMapper objectMapper;
    private final WebhookSignatureVerifier verifier;

    /**
     * Creates the controller.
     *
     * @param theReviewService the review service
     * @param theObjectMapper the mapper used to read deliveries
     * @param secret the webhook secret
     */
    public GitHubWebhookController(final ReviewService theReviewService,
            final ObjectMapper theObjectMapper,
            @Value("${github.webhook.secret:}") final String secret) {
        this.reviewService = theReviewService;
        this.objectMapper = theObjectMapper;
        this.verifier = new WebhookSignatureVerifier(secret);
    }

    /**
     * Handles one delivery.
     *
     * @param event the {@code X-GitHub-Event} header
     * @param signature the {@code X-Hub-Signature-256} header
     * @param delivery the {@code X-GitHub-Delivery} id, for the logs
     * @param payload the raw body
     * @return 202 when a review started, 200 when the event is ignored
     */
    @Operation(summary = "GitHub webhook",
            description = "Starts a review for pull_request opened and synchronize"
                    + " events and posts the summary comment when it completes.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Review started"),
            @ApiResponse(responseCode = "200", description = "Event ignored"),
            @ApiResponse(responseCode = "400", description = "Unreadable payload"),
            @ApiResponse(responseCode = "401", description = "Bad signature")
    })
    @PostMapping("/github")
    public ResponseEntity<?> github(
            @RequestHeader(value = "X-GitHub-Event", required = false) final String event,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) final String signature,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) final String delivery,
            @RequestBody final byte[] payload) {

        if (!verifier.verify(payload, signature)) {
            LOG.warn("Rejected GitHub delivery {} with an invalid signature",
                    delivery);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(new ErrorResponse("Invalid signature", UNAUTHORIZED));
        }
        if ("ping".equals(event)) {
            return ResponseEntity.ok(WebhookResponse.message("pong"));
        }
        if (!"pull_request".equals(event)) {
            LOG.debug("Ignoring GitHub event {}", event);
            return ResponseEntity.ok(WebhookResponse.message(
                    "Event '" + event + "' ignored"));
        }

        final JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (final IOException e) {
            LOG.warn("Unreadable GitHub delivery {}: {}", delivery, e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(
                    "Unreadable payload", ReviewValidationException.CODE));
        }

        final String action = root.path("action").asText("");
        if (!REVIEWED_ACTIONS.contains(action)) {
            return ResponseEntity.ok(WebhookResponse.message(
                    "Action '" + action + "' ignored"));
        }
        final String repository = root.path("repository")
                .path("full_name").asText("");
        final int number = root.path("pull_request").path("number").asInt(0);
        if (repository.isBlank() || number <= 0) {
            return ResponseEntity.badRequest().body(new ErrorResponse(
                    "Payload has no repository or pull request number",
                    ReviewValidationException.CODE));
        }

        LOG.info("GitHub delivery {}: {} on {}#{}", delivery, action,
                repository, number);
        try {
            final ReviewStatus status = reviewService.submitPullRequest(
                    repository, number, true, null);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(
                    new WebhookResponse("Review started", status.reviewId(),
                            repository, number));
        } catch (final ReviewValidationException | IllegalArgumentException e) {
            LOG.warn("Pull request {}#{} not reviewable: {}", repository,
                    number, e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(
                    e.getMessage(), ReviewValidationException.CODE));
        } catch (final DomainException e) {
            LOG.error("Pull request review failed for {}#{}: {}", repository,
                    number, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ErrorResponse(e.getMessage(), e.getErrorCode()));
        }
    }

    /**
     * Webhook answer.
     *
     * @param message what happened
     * @param reviewId the started review, if any
     * @param repository the repository, if a review started
     * @param pullNumber the pull request, if a review started
     */
    public record WebhookResponse(String message, String reviewId,
            String repository, Integer pullNumber) {

        static WebhookResponse message(final String message) {
            return new WebhookResponse(message, null, null, null);
        }
    }

}
