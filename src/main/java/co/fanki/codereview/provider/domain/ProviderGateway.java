package co.fanki.codereview.provider.domain;

import co.fanki.codereview.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.DoubleAdder;
import java.util.function.Predicate;

/**
 * Routes completions to the primary provider and, when it fails, once to
 * the fallback.
 *
 * <p>There are no other retries. A blank completion, or one the caller
 * rejects as malformed, counts as a failure.
 * When both providers fail the caller gets a {@link ProviderException}
 * carrying the fallback error, with the primary error attached as
 * suppressed.</p>
 *
 * <p>Every call that returns a response is priced and recorded on the
 * {@link CostLedger}, rejected ones included, and the invocation's cost
 * is the spend of all its calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ProviderGateway {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProviderGateway.class);

    private final ModelProvider primary;

    private final ModelProvider fallback;

    private final PricingTable pricing;

    private final CostLedger ledger;

    /**
     * Creates the gateway.
     *
     * @param thePrimary the provider tried first
     * @param theFallback the provider tried once when the primary fails,
     *        may be null
     * @param thePricing the price table
     * @param theLedger the spend ledger
     */
    public ProviderGateway(final ModelProvider thePrimary,
            final ModelProvider theFallback, final PricingTable thePricing,
            final CostLedger theLedger) {
        this.primary = Preconditions.requireNonNull(thePrimary,
                "Primary provider is required");
        this.fallback = theFallback;
        this.pricing = Preconditions.requireNonNull(thePricing,
                "Pricing table is required");
        this.ledger = Preconditions.requireNonNull(theLedger,
                "Cost ledger is required");
    }

    /**
     * Completes a prompt through the primary provider, then the fallback.
     *
     * @param systemPrompt the system instructions
     * @param userPrompt the user message
     * @return the invocation
     * @throws ProviderException when every provider failed
     */
    public ProviderInvocation invoke(final String systemPrompt,
            final String userPrompt) {
        return invoke(systemPrompt, userPrompt, content -> true);
    }

    /**
     * Completes a prompt, treating content rejected by {@code accept} as a
     * provider failure.
     *
     * @param systemPrompt the system instructions
     * @param userPrompt the user message
     * @param accept decides whether a completion is usable
     * @return the invocation
     * @throws ProviderException when every provider failed
     */
    public ProviderInvocation invoke(final String systemPrompt,
            final String userPrompt, final Predicate<String> accept) {
        Preconditions.requireNonNull(accept, "Acceptance check is required");
        final long start = System.currentTimeMillis();
        final DoubleAdder spent = new DoubleAdder();
        final ProviderException primaryFailure;
        try {
            return attempt(primary, systemPrompt, userPrompt, accept, start,
                    spent, false);
        } catch (final ProviderException e) {
            primaryFailure = e;
        } catch (final RuntimeException e) {
            primaryFailure = new ProviderException(primary.name(),
                    ProviderException.Kind.TRANSIENT, e.getMessage(), e);
        }
        ledger.recordFailure();

        if (Thread.currentThread().isInterrupted()) {
            throw primaryFailure;
        }
        if (fallback == null) {
            LOG.warn("Provider {} failed and no fallback is configured: {}",
                    primary.name(), primaryFailure.getMessage());
            throw primaryFailure;
        }

        LOG.warn("Provider {} failed ({}), falling back to {}",
                primary.name(), primaryFailure.getMessage(), fallback.name());
        try {
            return attempt(fallback, systemPrompt, userPrompt, accept, start,
                    spent, true);
        } catch (final RuntimeException e) {
            ledger.recordFailure();
            final ProviderException terminal = new ProviderException(
                    fallback.name(), ProviderException.Kind.PERMANENT,
                    "All providers failed. " + primary.name() + ": "
                            + primaryFailure.getMessage() + "; "
                            + fallback.name() + ": " + e.getMessage(), e);
            terminal.addSuppressed(primaryFailure);
            throw terminal;
        }
    }

    private ProviderInvocation attempt(final ModelProvider provider,
            final String systemPrompt, final String userPrompt,
            final Predicate<String> accept, final long start,
            final DoubleAdder spent, final boolean isFallback) {
        final ProviderResponse response = provider.complete(systemPrompt,
                userPrompt);
        if (response == null) {
            throw new ProviderException(provider.name(),
                    ProviderException.Kind.PERMANENT,
                    "No response from " + provider.name());
        }
        final String model = response.model() != null
                ? response.model() : provider.model();
        final double cost = pricing.cost(model, response.inputTokens(),
                response.outputTokens());
        ledger.record(provider.name(), cost);
        spent.add(cost);

        if (response.content() == null || response.content().isBlank()) {
            throw new ProviderException(provider.name(),
                    ProviderException.Kind.PERMANENT,
                    "Empty completion from " + provider.name());
        }
        if (!accept.test(response.content())) {
            throw new ProviderException(provider.name(),
                    ProviderException.Kind.PERMANENT,
                    "Malformed completion from " + provider.name());
        }
        final long elapsed = System.currentTimeMillis() - start;
        LOG.debug("Provider {} answered with model {} in {}ms, cost ${}",
                provider.name(), model, elapsed, cost);
        return new ProviderInvocation(response.content(), provider.name(),
                model, response.inputTokens(), response.outputTokens(),
                spent.sum(), elapsed, isFallback);
    }

}
