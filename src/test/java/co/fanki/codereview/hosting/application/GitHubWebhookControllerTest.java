package co.fanki.codereview.hosting.application;

import co.fanki.codereview.hosting.domain.WebhookSignatureVerifier;
import co.fanki.codereview.review.application.ReviewService;
import co.fanki.codereview.review.domain.ReviewStage;
import co.fanki.codereview.review.domain.ReviewStatus;
import co.fanki.codereview.shared.DomainException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.ByteArrayHttpMessageConverter;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.isNull;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link GitHubWebhookController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GitHubWebhookControllerTest {

    private static final String SECRET = "webhook-secret";

    private static final String OPENED = """
            {"action": "opened",
             "number": 7,
             "pull_request": {"number": 7, "title": "Add login"},
             "repository": {"full_name": "acme/api"}}
            """;

    private ReviewService service;

    private MockMvc mockMvc;

    private final WebhookSignatureVerifier signer =
            new WebhookSignatureVerifier(SECRET);

    @BeforeEach
    void setUp() {
        service = createMock(ReviewService.class);
        final ObjectMapper mapper = Jackson2ObjectMapperBuilder.json()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();
        mockMvc = MockMvcBuilders.standaloneSetup(new GitHubWebhookController(
                        service, mapper, SECRET))
                .setMessageConverters(new ByteArrayHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(mapper))
                .build();
    }

    @Test
    void whenReceiving_givenSignedOpenedPullRequest_shouldStartReview()
            throws Exception {
        expect(service.submitPullRequest(eq("acme/api"), eq(7), eq(true),
                isNull())).andReturn(new ReviewStatus("r-9", ReviewStage.PENDING,
                        0, null, null, Instant.parse("2026-01-01T10:00:00Z"),
                        null));
        replay(service);

        deliver("pull_request", OPENED, signer.sign(bytes(OPENED)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.review_id").value("r-9"))
                .andExpect(jsonPath("$.repository").value("acme/api"))
                .andExpect(jsonPath("$.pull_number").value(7));

        verify(service);
    }

    @Test
    void whenReceiving_givenWrongSignature_shouldRejectWithoutReview()
            throws Exception {
        replay(service);

        deliver("pull_request", OPENED,
                new WebhookSignatureVerifier("other").sign(bytes(OPENED)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value(
                        GitHubWebhookController.UNAUTHORIZED));

        verify(service);
    }

    @Test
    void whenReceiving_givenMissingSignature_shouldReject() throws Exception {
        replay(service);

        mockMvc.perform(post("/api/webhooks/github")
                        .header("X-GitHub-Event", "pull_request")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(OPENED))
                .andExpect(status().isUnauthorized());

        verify(service);
    }

    @Test
    void whenReceiving_givenClosedPullRequest_shouldIgnore() throws Exception {
        replay(service);
        final String closed = OPENED.replace("opened", "closed");

        deliver("pull_request", closed, signer.sign(bytes(closed)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Action 'closed' ignored"));

        verify(service);
    }

    @Test
    void whenReceiving_givenPing_shouldAnswerPong() throws Exception {
        replay(service);
        final String ping = "{\"zen\": \"Keep it logically awesome.\"}";

        deliver("ping", ping, signer.sign(bytes(ping)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("pong"));

        verify(service);
    }

    @Test
    void whenReceiving_givenPayloadWithoutRepository_shouldReturnBadRequest()
            throws Exception {
        replay(service);
        final String payload = "{\"action\": \"synchronize\","
                + " \"pull_request\": {\"number\": 3}}";

        deliver("pull_request", payload, signer.sign(bytes(payload)))
                .andExpect(status().isBadRequest());

        verify(service);
    }

    @Test
    void whenReceiving_givenHostingDisabled_shouldReturnBadGateway()
            throws Exception {
        expect(service.submitPullRequest(eq("acme/api"), eq(7), eq(true),
                isNull())).andThrow(new DomainException(
                        "GitHub integration is disabled", "HOSTING_DISABLED"));
        replay(service);

        deliver("pull_request", OPENED, signer.sign(bytes(OPENED)))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error_code").value("HOSTING_DISABLED"));

        verify(service);
    }

    private ResultActions deliver(final String event, final String body,
            final String signature) throws Exception {
        return mockMvc.perform(post("/api/webhooks/github")
                .header("X-GitHub-Event", event)
                .header("X-GitHub-Delivery", "d-1")
                .header("X-Hub-Signature-256", signature)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private static byte[] bytes(final String body) {
        return body.getBytes(StandardCharsets.UTF_8);
    }

}
