package co.fanki.codereview.producer.domain;

import co.fanki.codereview.provider.domain.ProviderGateway;
import co.fanki.codereview.review.domain.ReviewOptions;

/**
 * Looks for exploitable vulnerabilities, OWASP Top 10 first.
 *
 * <p>Runs unless {@code enable_security} is false.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SecurityProducer extends PromptedProducer {

    /** Producer name. */
    public static final String NAME = "security";

    private static final String SYSTEM_PROMPT = """
            You are a security expert specializing in:
            - OWASP Top 10 vulnerabilities
            - SQL injection, XSS, CSRF
            - Authentication and authorization flaws
            - Insecure data handling and cryptographic issues
            - Input validation and security misconfigurations

            You think like an attacker to find exploitable vulnerabilities.
            Include the CWE id of each vulnerability when one applies.
            """;

    /**
     * Creates the producer.
     *
     * @param gateway the provider gateway
     * @param parser the completion parser
     * @param confidenceThreshold findings below it are dropped
     * @param selfReflection whether to re-check findings
     */
    public SecurityProducer(final ProviderGateway gateway, final FindingParser parser,
            final double confidenceThreshold, final boolean selfReflection) {
        super(gateway, parser, confidenceThreshold, selfReflection);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean enabledBy(final ReviewOptions options) {
        return options.enableSecurity();
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String focus() {
        return "security vulnerabilities";
    }

}
