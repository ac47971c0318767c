package co.fanki.codereview.config;

import co.fanki.codereview.review.application.ReviewRequest;
import co.fanki.codereview.review.application.ReviewRequest.FileInput;
import co.fanki.codereview.review.application.ReviewService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Exposes the review operations as MCP tools over stdio.
 *
 * <p>Enabled with {@code mcp.server.stdio=true}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String SUBMIT_REVIEW_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "files": {
                  "type": "array",
                  "description": "The files to review",
                  "items": {
                    "type": "object",
                    "properties": {
                      "path": {"type": "string"},
                      "content": {"type": "string"},
                      "language": {"type": "string"}
                    },
                    "required": ["path", "content"]
                  }
                },
                "options": {
                  "type": "object",
                  "description": "enable_security, enable_performance, enable_documentation"
                }
              },
              "required": ["files"]
            }
            """;

    private static final String REVIEW_ID_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "review_id": {
                  "type": "string",
                  "description": "The review id returned by submit_review"
                }
              },
              "required": ["review_id"]
            }
            """;

    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates the MCP server with the review tools.
     *
     * @param transportProvider the stdio transport
     * @param reviewService the review service
     * @param objectMapper the mapper for tool results
     * @return the server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final ReviewService reviewService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("code-review-server", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(submitReviewTool(reviewService, objectMapper));
        server.addTool(reviewStatusTool(reviewService, objectMapper));
        server.addTool(deleteReviewTool(reviewService, objectMapper));

        LOG.info("MCP stdio server initialized with 3 tools");
        return server;
    }

    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    @SuppressWarnings("unchecked")
    private McpServerFeatures.SyncToolSpecification submitReviewTool(
            final ReviewService reviewService, final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("submit_review",
                        "Start a code review of one or more files. Returns a"
                                + " review_id; poll it with get_review_status.",
                        SUBMIT_REVIEW_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final List<Map<String, Object>> rawFiles =
                                (List<Map<String, Object>>) arguments.get("files");
                        final List<FileInput> files = new ArrayList<>();
                        if (rawFiles != null) {
                            for (final Map<String, Object> raw : rawFiles) {
                                files.add(new FileInput(
                                        (String) raw.get("path"),
                                        (String) raw.get("content"),
                                        (String) raw.get("language")));
                            }
                        }
                        final Map<String, Object> options =
                                (Map<String, Object>) arguments.get("options");
                        return toCallToolResult(objectMapper,
                                reviewService.submit(new ReviewRequest(files, options)));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                });
    }

    private McpServerFeatures.SyncToolSpecification reviewStatusTool(
            final ReviewService reviewService, final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("get_review_status",
                        "Get the stage, progress and, once complete, the"
                                + " report of a review.",
                        REVIEW_ID_SCHEMA),
                (exchange, arguments) -> {
                    final String reviewId = (String) arguments.get("review_id");
                    try {
                        return reviewService.status(reviewId)
                                .map(status -> toCallToolResult(objectMapper, status))
                                .orElseGet(() -> new CallToolResult(List.of(
                                        new McpSchema.TextContent(
                                                "Review not found: " + reviewId)),
                                        true));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                });
    }

    private McpServerFeatures.SyncToolSpecification deleteReviewTool(
            final ReviewService reviewService, final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("delete_review",
                        "Cancel a running review and drop it.",
                        REVIEW_ID_SCHEMA),
                (exchange, arguments) -> {
                    final String reviewId = (String) arguments.get("review_id");
                    try {
                        return toCallToolResult(objectMapper, Map.of("deleted",
                                reviewService.delete(reviewId)));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                });
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final JsonProcessingException e) {
            return errorResult(e);
        }
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
