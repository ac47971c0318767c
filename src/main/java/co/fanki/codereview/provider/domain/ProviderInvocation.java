package co.fanki.codereview.provider.domain;

/**
 * Result of a gateway call, with the provider that served it and its cost.
 *
 * @param content the completion text
 * @param provider the provider that answered
 * @param model the model that answered
 * @param inputTokens prompt tokens
 * @param outputTokens completion tokens
 * @param cost the cost in dollars of every call made, rejected ones included
 * @param elapsedMillis wall time of the call, fallback included
 * @param fallback whether the fallback provider served it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProviderInvocation(
        String content,
        String provider,
        String model,
        long inputTokens,
        long outputTokens,
        double cost,
        long elapsedMillis,
        boolean fallback) {
}
