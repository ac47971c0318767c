package co.fanki.codereview.producer.domain;

import co.fanki.codereview.provider.domain.ProviderGateway;
import co.fanki.codereview.review.domain.ReviewOptions;

/**
 * Looks for bugs, logic errors and code smells. Always runs.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalyzerProducer extends PromptedProducer {

    /** Producer name. */
    public static final String NAME = "analyzer";

    private static final String SYSTEM_PROMPT = """
            You are an expert code analyzer with deep knowledge of:
            - Common bug patterns across multiple languages
            - Edge cases and boundary conditions
            - Logic errors and race conditions
            - Type safety issues
            - Error handling best practices
            - Code smells and anti-patterns

            You provide actionable, specific feedback with exact line numbers.
            """;

    /**
     * Creates the producer.
     *
     * @param gateway the provider gateway
     * @param parser the completion parser
     * @param confidenceThreshold findings below it are dropped
     * @param selfReflection whether to re-check findings
     */
    public AnalyzerProducer(final ProviderGateway gateway, final FindingParser parser,
            final double confidenceThreshold, final boolean selfReflection) {
        super(gateway, parser, confidenceThreshold, selfReflection);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean enabledBy(final ReviewOptions options) {
        return true;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String focus() {
        return "bugs, logic errors and code quality issues";
    }

}
