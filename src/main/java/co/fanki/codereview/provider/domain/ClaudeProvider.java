package co.fanki.codereview.provider.domain;

import co.fanki.codereview.shared.Preconditions;
import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.anthropic.errors.AnthropicIoException;
import com.anthropic.errors.AnthropicServiceException;
import com.anthropic.models.messages.Message;
import com.anthropic.models.messages.MessageCreateParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Primary provider, backed by the Anthropic Messages API.
 *
 * <p>The SDK's own retries are disabled: one call is one attempt.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ClaudeProvider implements ModelProvider {

    private static final Logger LOG = LoggerFactory.getLogger(
            ClaudeProvider.class);

    private static final String NAME = "claude";

    private final AnthropicClient client;

    private final String model;

    private final long maxTokens;

    /**
     * Creates the provider with its own HTTP client.
     *
     * @param apiKey the Anthropic API key
     * @param theModel the model id
     * @param theMaxTokens the completion token limit
     * @param timeout the per-call timeout
     */
    public ClaudeProvider(final String apiKey, final String theModel,
            final long theMaxTokens, final Duration timeout) {
        this(AnthropicOkHttpClient.builder()
                .apiKey(Preconditions.requireNonBlank(apiKey,
                        "API key is required"))
                .timeout(timeout)
                .maxRetries(0)
                .build(), theModel, theMaxTokens);
    }

    ClaudeProvider(final AnthropicClient theClient, final String theModel,
            final long theMaxTokens) {
        this.client = Preconditions.requireNonNull(theClient,
                "Anthropic client is required");
        this.model = Preconditions.requireNonBlank(theModel,
                "Model is required");
        this.maxTokens = theMaxTokens;
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
        final MessageCreateParams params = MessageCreateParams.builder()
                .maxTokens(maxTokens)
                .system(systemPrompt)
                .addUserMessage(userPrompt)
                .model(model)
                .build();
        try {
            final Message response = client.messages().create(params);

            final String content = response.content().stream()
                    .flatMap(block -> block.text().stream())
                    .map(textBlock -> textBlock.text())
                    .reduce("", String::concat);

            return new ProviderResponse(content, response.model().toString(),
                    response.usage().inputTokens(),
                    response.usage().outputTokens());

        } catch (final AnthropicServiceException e) {
            final int status = e.statusCode();
            LOG.warn("Claude API returned {}: {}", status, e.getMessage());
            throw new ProviderException(NAME, status == 429 || status >= 500
                    ? ProviderException.Kind.TRANSIENT
                    : ProviderException.Kind.PERMANENT,
                    "Claude API error " + status, e);
        } catch (final AnthropicIoException e) {
            throw new ProviderException(NAME, ProviderException.Kind.TRANSIENT,
                    "Claude API unreachable: " + e.getMessage(), e);
        }
    }

}
