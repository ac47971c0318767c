package co.fanki.codereview.provider.domain;

/**
 * Raw completion returned by a model provider.
 *
 * @param content the completion text
 * @param model the model that answered
 * @param inputTokens prompt tokens billed
 * @param outputTokens completion tokens billed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProviderResponse(
        String content,
        String model,
        long inputTokens,
        long outputTokens) {
}
