package co.fanki.codereview.producer.domain;

import co.fanki.codereview.provider.domain.ProviderGateway;
import co.fanki.codereview.review.domain.ReviewOptions;

/**
 * Reviews documentation quality.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DocumenterProducer extends PromptedProducer {

    /** Producer name. */
    public static final String NAME = "documenter";

    private static final String SYSTEM_PROMPT = """
            You are a documentation quality expert focusing on:
            - Function and class documentation
            - API documentation
            - Inline comments quality
            - Type hints and annotations
            - Code readability

            You ensure code is well-documented and maintainable.
            """;

    /**
     * Creates the producer.
     *
     * @param gateway the provider gateway
     * @param parser the completion parser
     * @param confidenceThreshold findings below it are dropped
     * @param selfReflection whether to re-check findings
     */
    public DocumenterProducer(final ProviderGateway gateway, final FindingParser parser,
            final double confidenceThreshold, final boolean selfReflection) {
        super(gateway, parser, confidenceThreshold, selfReflection);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean enabledBy(final ReviewOptions options) {
        return options.enableDocumentation();
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String focus() {
        return "documentation quality";
    }

}
