package co.fanki.codereview.config;

import co.fanki.codereview.review.application.ReviewRequest;
import co.fanki.codereview.review.application.ReviewService;
import co.fanki.codereview.review.domain.ReviewStage;
import co.fanki.codereview.review.domain.ReviewStatus;
import co.fanki.codereview.review.domain.ReviewValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import org.easymock.Capture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link McpStdioServerConfiguration}.
 *
 * <p>A client talks JSON-RPC to the stdio server over in-process pipes,
 * with a mocked {@link ReviewService} behind the tools.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class McpStdioServerConfigurationTest {

    private final ObjectMapper protocolMapper = new ObjectMapper();

    private ReviewService reviewService;

    private McpSyncServer server;

    private PrintWriter clientWriter;

    private BufferedReader clientReader;

    private PipedOutputStream clientToServer;

    @BeforeEach
    void setUp() throws Exception {
        clientToServer = new PipedOutputStream();
        final PipedInputStream serverIn = new PipedInputStream(clientToServer);
        final PipedOutputStream serverOut = new PipedOutputStream();
        final PipedInputStream serverToClient = new PipedInputStream(serverOut);

        reviewService = createMock(ReviewService.class);

        final StdioServerTransportProvider transport =
                new StdioServerTransportProvider(protocolMapper, serverIn,
                        serverOut);
        final ObjectMapper resultMapper = Jackson2ObjectMapperBuilder.json()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();

        server = new McpStdioServerConfiguration().mcpSyncServer(transport,
                reviewService, resultMapper);

        clientWriter = new PrintWriter(new OutputStreamWriter(clientToServer));
        clientReader = new BufferedReader(new InputStreamReader(serverToClient));
    }

    @AfterEach
    void tearDown() throws IOException {
        clientToServer.close();
        if (server != null) {
            server.close();
        }
    }

    @Test
    void whenListingTools_shouldExposeTheThreeReviewTools() throws Exception {
        replay(reviewService);
        performHandshake();

        send("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"tools/list\","
                + "\"params\":{}}");

        final JsonNode tools = readJson().path("result").path("tools");
        assertTrue(tools.isArray());
        assertEquals(3, tools.size());
        assertTrue(tools.toString().contains("\"submit_review\""));
        assertTrue(tools.toString().contains("\"get_review_status\""));
        assertTrue(tools.toString().contains("\"delete_review\""));
    }

    @Test
    void whenSubmittingReview_givenFiles_shouldReturnPendingReview()
            throws Exception {
        final Capture<ReviewRequest> request = newCapture();
        expect(reviewService.submit(capture(request))).andReturn(
                statusOf("r-1", ReviewStage.PENDING));
        replay(reviewService);
        performHandshake();

        callTool(20, "submit_review", "{\"files\":[{\"path\":\"src/app.py\","
                + "\"content\":\"x = 1\"}],"
                + "\"options\":{\"enable_security\":false}}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode status = textAsJson(result);
        assertEquals("r-1", status.path("review_id").asText());
        assertEquals("pending", status.path("stage").asText());

        assertEquals(1, request.getValue().files().size());
        assertEquals("src/app.py", request.getValue().files().get(0).path());
        assertEquals(Boolean.FALSE, request.getValue().options().get("enable_security"));
        verify(reviewService);
    }

    @Test
    void whenSubmittingReview_givenInvalidBatch_shouldReturnError()
            throws Exception {
        expect(reviewService.submit(anyObject(ReviewRequest.class))).andThrow(
                new ReviewValidationException("At least one file is required"));
        replay(reviewService);
        performHandshake();

        callTool(21, "submit_review", "{\"files\":[]}");

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean());
        assertTrue(text(result).contains("At least one file is required"));
        verify(reviewService);
    }

    @Test
    void whenGettingStatus_givenUnknownReview_shouldReturnError()
            throws Exception {
        expect(reviewService.status("missing")).andReturn(Optional.empty());
        replay(reviewService);
        performHandshake();

        callTool(22, "get_review_status", "{\"review_id\":\"missing\"}");

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean());
        assertEquals("Review not found: missing", text(result));
        verify(reviewService);
    }

    @Test
    void whenGettingStatus_givenRunningReview_shouldReturnStageAndProgress()
            throws Exception {
        expect(reviewService.status("r-1")).andReturn(Optional.of(
                statusOf("r-1", ReviewStage.PRODUCING)));
        replay(reviewService);
        performHandshake();

        callTool(23, "get_review_status", "{\"review_id\":\"r-1\"}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode status = textAsJson(result);
        assertEquals("producing", status.path("stage").asText());
        assertEquals(40, status.path("progress").asInt());
        verify(reviewService);
    }

    @Test
    void whenDeletingReview_givenKnownReview_shouldReportDeleted()
            throws Exception {
        expect(reviewService.delete("r-1")).andReturn(true);
        replay(reviewService);
        performHandshake();

        callTool(24, "delete_review", "{\"review_id\":\"r-1\"}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        assertTrue(textAsJson(result).path("deleted").asBoolean());
        verify(reviewService);
    }

    private void callTool(final int id, final String name,
            final String arguments) {
        send("{\"jsonrpc\":\"2.0\",\"id\":" + id
                + ",\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"" + name + "\","
                + "\"arguments\":" + arguments + "}}");
    }

    private void performHandshake() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
                + "\"params\":{\"protocolVersion\":\"2024-11-05\","
                + "\"capabilities\":{},"
                + "\"clientInfo\":{\"name\":\"test-client\","
                + "\"version\":\"1.0\"}}}");

        readJson();

        send("{\"jsonrpc\":\"2.0\","
                + "\"method\":\"notifications/initialized\","
                + "\"params\":{}}");

        Thread.sleep(50);
    }

    private void send(final String json) {
        clientWriter.println(json);
        clientWriter.flush();
    }

    private JsonNode readJson() throws Exception {
        final CompletableFuture<String> future =
                CompletableFuture.supplyAsync(() -> {
                    try {
                        return clientReader.readLine();
                    } catch (final IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
        final String line = future.get(5, TimeUnit.SECONDS);
        assertNotNull(line, "Server did not respond within 5 seconds");
        return protocolMapper.readTree(line);
    }

    private static String text(final JsonNode result) {
        return result.path("content").get(0).path("text").asText();
    }

    private JsonNode textAsJson(final JsonNode result) throws Exception {
        return protocolMapper.readTree(text(result));
    }

    private static ReviewStatus statusOf(final String id,
            final ReviewStage stage) {
        return new ReviewStatus(id, stage, stage.progress(), null, null,
                Instant.parse("2026-01-01T10:00:00Z"), null);
    }

}
