package co.fanki.codereview.config;

import co.fanki.codereview.cache.application.CacheGate;
import co.fanki.codereview.cache.domain.InMemoryResultCache;
import co.fanki.codereview.cache.domain.JdbiResultCache;
import co.fanki.codereview.cache.domain.ResultCache;
import co.fanki.codereview.context.domain.JdbiKnowledgeStore;
import co.fanki.codereview.context.domain.KnowledgeStore;
import co.fanki.codereview.context.domain.LineMetricsStaticAnalyzer;
import co.fanki.codereview.context.domain.StaticAnalyzer;
import co.fanki.codereview.hosting.domain.GitHubClient;
import co.fanki.codereview.hosting.domain.SourceHostingClient;
import co.fanki.codereview.producer.domain.AnalyzerProducer;
import co.fanki.codereview.producer.domain.DocumenterProducer;
import co.fanki.codereview.producer.domain.FindingParser;
import co.fanki.codereview.producer.domain.OptimizerProducer;
import co.fanki.codereview.producer.domain.ProducerCatalog;
import co.fanki.codereview.producer.domain.SecurityProducer;
import co.fanki.codereview.provider.domain.ClaudeProvider;
import co.fanki.codereview.provider.domain.CostLedger;
import co.fanki.codereview.provider.domain.ModelProvider;
import co.fanki.codereview.provider.domain.OpenAiProvider;
import co.fanki.codereview.provider.domain.PricingTable;
import co.fanki.codereview.provider.domain.ProviderGateway;
import co.fanki.codereview.review.application.ReviewPipeline;
import co.fanki.codereview.review.application.ReviewRegistry;
import co.fanki.codereview.review.application.ReviewRequestValidator;
import co.fanki.codereview.review.application.ReviewService;
import co.fanki.codereview.review.domain.Consolidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

/**
 * Wires the review pipeline and its collaborators.
 *
 * <p>Providers: {@code review.provider.primary} and
 * {@code review.provider.fallback} name {@code claude} or {@code openai};
 * a fallback without credentials is left out.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ReviewConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReviewConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CostLedger costLedger() {
        return new CostLedger();
    }

    @Bean
    public PricingTable pricingTable(
            @Value("${review.pricing.overrides:}") final List<String> overrides) {
        return PricingTable.defaults().withOverrides(overrides);
    }

    /**
     * Creates the provider gateway.
     *
     * @param primary the primary provider name
     * @param fallback the fallback provider name, or none
     * @param claude the Claude settings
     * @param openAi the OpenAI-compatible settings
     * @param restTemplate the HTTP client for the OpenAI-compatible provider
     * @param objectMapper the JSON mapper
     * @param pricing the price table
     * @param ledger the spend ledger
     * @return the gateway
     */
    @Bean
    public ProviderGateway providerGateway(
            @Value("${review.provider.primary:claude}") final String primary,
            @Value("${review.provider.fallback:openai}") final String fallback,
            final ClaudeSettings claude,
            final OpenAiSettings openAi,
            final RestTemplate restTemplate,
            final ObjectMapper objectMapper,
            final PricingTable pricing,
            final CostLedger ledger) {

        final ModelProvider primaryProvider = provider(primary, claude, openAi,
                restTemplate, objectMapper);
        ModelProvider fallbackProvider = null;
        if (!"none".equalsIgnoreCase(fallback) && !fallback.equalsIgnoreCase(primary)) {
            if (configured(fallback, claude, openAi)) {
                fallbackProvider = provider(fallback, claude, openAi,
                        restTemplate, objectMapper);
            } else {
                LOG.warn("Fallback provider {} has no credentials, running"
                        + " without fallback", fallback);
            }
        }
        LOG.info("Provider gateway: primary={}, fallback={}",
                primaryProvider.name(),
                fallbackProvider == null ? "none" : fallbackProvider.name());
        return new ProviderGateway(primaryProvider, fallbackProvider, pricing,
                ledger);
    }

    @Bean
    public ClaudeSettings claudeSettings(
            @Value("${claude.api-key:}") final String apiKey,
            @Value("${claude.model:claude-sonnet-4-20250514}") final String model,
            @Value("${review.provider.max-tokens:4096}") final long maxTokens,
            @Value("${review.provider.timeout:120s}") final Duration timeout) {
        return new ClaudeSettings(apiKey, model, maxTokens, timeout);
    }

    @Bean
    public OpenAiSettings openAiSettings(
            @Value("${openai.endpoint:https://api.openai.com/v1/chat/completions}")
            final String endpoint,
            @Value("${openai.api-key:}") final String apiKey,
            @Value("${openai.model:gpt-4o}") final String model,
            @Value("${openai.azure:false}") final boolean azure,
            @Value("${review.provider.max-tokens:4096}") final long maxTokens) {
        return new OpenAiSettings(endpoint, apiKey, model, azure, maxTokens);
    }

    @Bean
    public FindingParser findingParser() {
        return new FindingParser();
    }

    /**
     * Creates the producer catalog, in report order.
     *
     * @param gateway the provider gateway
     * @param parser the completion parser
     * @param threshold the minimum confidence kept
     * @param selfReflection whether producers re-check their findings
     * @return the catalog
     */
    @Bean
    public ProducerCatalog producerCatalog(
            final ProviderGateway gateway,
            final FindingParser parser,
            @Value("${review.producer.confidence-threshold:0.7}") final double threshold,
            @Value("${review.producer.self-reflection:false}") final boolean selfReflection) {
        return new ProducerCatalog(List.of(
                new AnalyzerProducer(gateway, parser, threshold, selfReflection),
                new SecurityProducer(gateway, parser, threshold, selfReflection),
                new OptimizerProducer(gateway, parser, threshold, selfReflection),
                new DocumenterProducer(gateway, parser, threshold, selfReflection)));
    }

    @Bean
    public Consolidator consolidator() {
        return new Consolidator();
    }

    /**
     * Creates the result store named by {@code review.cache.store}.
     *
     * @param store jdbc or memory
     * @param jdbi the Jdbi instance, used for jdbc
     * @param clock the clock
     * @return the store
     */
    @Bean
    public ResultCache resultCache(
            @Value("${review.cache.store:jdbc}") final String store,
            final ObjectProvider<Jdbi> jdbi,
            final Clock clock) {
        if ("memory".equalsIgnoreCase(store)) {
            return new InMemoryResultCache(clock);
        }
        return new JdbiResultCache(jdbi.getObject(), clock);
    }

    @Bean
    public CacheGate cacheGate(
            final ResultCache resultCache,
            final ObjectMapper objectMapper,
            @Value("${review.cache.ttl:1h}") final Duration ttl,
            @Value("${review.cache.enabled:true}") final boolean enabled) {
        return new CacheGate(resultCache, objectMapper, ttl, enabled);
    }

    @Bean
    public StaticAnalyzer staticAnalyzer(
            @Value("${review.static-analysis.max-line-length:120}") final int maxLineLength) {
        return new LineMetricsStaticAnalyzer(maxLineLength);
    }

    /**
     * Creates the knowledge store, or one that knows nothing when
     * {@code review.knowledge.enabled=false}.
     *
     * @param enabled whether to query the best practices table
     * @param jdbi the Jdbi instance
     * @return the store
     */
    @Bean
    public KnowledgeStore knowledgeStore(
            @Value("${review.knowledge.enabled:true}") final boolean enabled,
            final ObjectProvider<Jdbi> jdbi) {
        if (!enabled) {
            return (query, language, topK) -> List.of();
        }
        return new JdbiKnowledgeStore(jdbi.getObject());
    }

    @Bean
    public ReviewRegistry reviewRegistry() {
        return new ReviewRegistry();
    }

    @Bean
    public ReviewPipeline reviewPipeline(
            final ReviewRegistry registry,
            final StaticAnalyzer staticAnalyzer,
            final KnowledgeStore knowledgeStore,
            final ProducerCatalog catalog,
            final CacheGate cacheGate,
            final Consolidator consolidator,
            @Qualifier("producerExecutor") final ExecutorService producerExecutor,
            @Value("${review.timeout:5m}") final Duration timeout,
            @Value("${review.enrichment.top-k:3}") final int topK) {
        return new ReviewPipeline(registry, staticAnalyzer, knowledgeStore,
                catalog, cacheGate, consolidator, producerExecutor, timeout,
                topK);
    }

    @Bean
    public ReviewRequestValidator reviewRequestValidator(
            @Value("${review.limits.max-files:50}") final int maxFiles,
            @Value("${review.limits.max-file-size:100000}") final int maxFileSize) {
        return new ReviewRequestValidator(maxFiles, maxFileSize);
    }

    /**
     * Creates the review service. The GitHub client is only wired when
     * {@code github.enabled=true}.
     *
     * @return the service
     */
    @Bean
    public ReviewService reviewService(
            final ReviewRegistry registry,
            final ReviewPipeline pipeline,
            final ReviewRequestValidator validator,
            @Qualifier("reviewExecutor") final ExecutorService reviewExecutor,
            final CostLedger ledger,
            final CacheGate cacheGate,
            @Value("${github.enabled:false}") final boolean githubEnabled,
            @Value("${github.api-url:https://api.github.com}") final String githubUrl,
            @Value("${github.token:}") final String githubToken,
            final RestTemplate restTemplate,
            final ObjectMapper objectMapper) {
        SourceHostingClient hosting = null;
        if (githubEnabled) {
            hosting = new GitHubClient(restTemplate, objectMapper, githubUrl,
                    githubToken);
        }
        return new ReviewService(registry, pipeline, validator, reviewExecutor,
                ledger, cacheGate, hosting);
    }

    private static ModelProvider provider(final String name,
            final ClaudeSettings claude, final OpenAiSettings openAi,
            final RestTemplate restTemplate, final ObjectMapper objectMapper) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "claude" -> new ClaudeProvider(claude.apiKey(), claude.model(),
                    claude.maxTokens(), claude.timeout());
            case "openai" -> new OpenAiProvider(restTemplate, objectMapper,
                    openAi.endpoint(), openAi.apiKey(), openAi.model(),
                    openAi.maxTokens(), openAi.azure());
            default -> throw new IllegalArgumentException(
                    "Unknown provider: " + name);
        };
    }

    private static boolean configured(final String name,
            final ClaudeSettings claude, final OpenAiSettings openAi) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "claude" -> !claude.apiKey().isBlank();
            case "openai" -> !openAi.apiKey().isBlank();
            default -> false;
        };
    }

    /**
     * Claude provider settings.
     *
     * @param apiKey the API key
     * @param model the model id
     * @param maxTokens the completion token limit
     * @param timeout the per-call timeout
     */
    public record ClaudeSettings(String apiKey, String model, long maxTokens,
            Duration timeout) {}

    /**
     * OpenAI-compatible provider settings.
     *
     * @param endpoint the chat completions URL
     * @param apiKey the API key
     * @param model the model or deployment id
     * @param azure whether the endpoint is Azure OpenAI
     * @param maxTokens the completion token limit
     */
    public record OpenAiSettings(String endpoint, String apiKey, String model,
            boolean azure, long maxTokens) {}

}
