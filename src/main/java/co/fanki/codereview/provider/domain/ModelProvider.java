package co.fanki.codereview.provider.domain;

/**
 * A model endpoint able to complete a prompt.
 *
 * <p>Implementations perform exactly one attempt per call; the gateway owns
 * the fallback policy.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ModelProvider {

    /**
     * Returns the provider name used in logs and cost reporting.
     *
     * @return the name, e.g. {@code "claude"}
     */
    String name();

    /**
     * Returns the configured model id.
     *
     * @return the model id
     */
    String model();

    /**
     * Completes the prompt.
     *
     * @param systemPrompt the system instructions
     * @param userPrompt the user message
     * @return the response
     * @throws ProviderException when no usable completion was returned
     */
    ProviderResponse complete(String systemPrompt, String userPrompt);

}
