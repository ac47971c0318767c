package co.fanki.codereview.provider.domain;

import co.fanki.codereview.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Fallback provider speaking the OpenAI chat completions protocol.
 *
 * <p>Works against OpenAI and Azure OpenAI deployments. Azure expects the
 * key in an {@code api-key} header, OpenAI as a bearer token.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class OpenAiProvider implements ModelProvider {

    private static final Logger LOG = LoggerFactory.getLogger(
            OpenAiProvider.class);

    private static final String NAME = "openai";

    private static final double TEMPERATURE = 0.1;

    private final RestTemplate restTemplate;

    private final ObjectMapper objectMapper;

    private final String endpoint;

    private final String apiKey;

    private final String model;

    private final long maxTokens;

    private final boolean azure;

    /**
     * Creates the provider.
     *
     * @param theRestTemplate the HTTP client, carrying the call timeouts
     * @param theObjectMapper the JSON mapper
     * @param theEndpoint the full chat completions URL
     * @param theApiKey the API key
     * @param theModel the model or deployment id
     * @param theMaxTokens the completion token limit
     * @param isAzure whether the endpoint is an Azure deployment
     */
    public OpenAiProvider(final RestTemplate theRestTemplate,
            final ObjectMapper theObjectMapper, final String theEndpoint,
            final String theApiKey, final String theModel,
            final long theMaxTokens, final boolean isAzure) {
        this.restTemplate = Preconditions.requireNonNull(theRestTemplate,
                "RestTemplate is required");
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "ObjectMapper is required");
        this.endpoint = Preconditions.requireNonBlank(theEndpoint,
                "Endpoint is required");
        this.apiKey = Preconditions.requireNonBlank(theApiKey,
                "API key is required");
        this.model = Preconditions.requireNonBlank(theModel,
                "Model is required");
        this.maxTokens = theMaxTokens;
        this.azure = isAzure;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public ProviderResponse complete(final String systemPrompt,
            final String userPrompt) {
        final HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (azure) {
            headers.set("api-key", apiKey);
        } else {
            headers.setBearerAuth(apiKey);
        }

        final String raw;
        try {
            raw = restTemplate.postForObject(endpoint,
                    new HttpEntity<>(requestBody(systemPrompt, userPrompt),
                            headers),
                    String.class);
        } catch (final HttpStatusCodeException e) {
            final int status = e.getStatusCode().value();
            LOG.warn("OpenAI endpoint returned {}: {}", status,
                    e.getResponseBodyAsString());
            throw new ProviderException(NAME, status == 429 || status >= 500
                    ? ProviderException.Kind.TRANSIENT
                    : ProviderException.Kind.PERMANENT,
                    "OpenAI API error " + status, e);
        } catch (final ResourceAccessException e) {
            throw new ProviderException(NAME, ProviderException.Kind.TRANSIENT,
                    "OpenAI API unreachable: " + e.getMessage(), e);
        }
        return parse(raw);
    }

    String requestBody(final String systemPrompt, final String userPrompt) {
        final ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", TEMPERATURE);
        final ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (final JsonProcessingException e) {
            throw new ProviderException(NAME, ProviderException.Kind.PERMANENT,
                    "Cannot encode request", e);
        }
    }

    ProviderResponse parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ProviderException(NAME, ProviderException.Kind.TRANSIENT,
                    "Empty response body");
        }
        try {
            final JsonNode root = objectMapper.readTree(raw);
            final JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                throw new ProviderException(NAME,
                        ProviderException.Kind.PERMANENT,
                        "Response carries no choices");
            }
            final String content = choices.get(0).path("message")
                    .path("content").asText("");
            final JsonNode usage = root.path("usage");
            return new ProviderResponse(content,
                    root.path("model").asText(model),
                    usage.path("prompt_tokens").asLong(0),
                    usage.path("completion_tokens").asLong(0));
        } catch (final JsonProcessingException e) {
            throw new ProviderException(NAME, ProviderException.Kind.PERMANENT,
                    "Malformed response: " + e.getOriginalMessage(), e);
        }
    }

}
