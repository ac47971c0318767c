package co.fanki.codereview.producer.domain;

import co.fanki.codereview.provider.domain.ProviderGateway;
import co.fanki.codereview.review.domain.ReviewOptions;

/**
 * Looks for performance bottlenecks. Runs unless {@code enable_performance}
 * is false.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class OptimizerProducer extends PromptedProducer {

    /** Producer name. */
    public static final String NAME = "optimizer";

    private static final String SYSTEM_PROMPT = """
            You are a performance optimization expert specializing in:
            - Algorithm complexity analysis
            - Database query optimization
            - Memory usage optimization
            - Caching strategies
            - Concurrency and resource management

            You identify bottlenecks and suggest concrete improvements.
            """;

    /**
     * Creates the producer.
     *
     * @param gateway the provider gateway
     * @param parser the completion parser
     * @param confidenceThreshold findings below it are dropped
     * @param selfReflection whether to re-check findings
     */
    public OptimizerProducer(final ProviderGateway gateway, final FindingParser parser,
            final double confidenceThreshold, final boolean selfReflection) {
        super(gateway, parser, confidenceThreshold, selfReflection);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean enabledBy(final ReviewOptions options) {
        return options.enablePerformance();
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String focus() {
        return "performance bottlenecks";
    }

}
