package co.fanki.codereview.producer.domain;

import co.fanki.codereview.context.domain.KnowledgeSnippet;
import co.fanki.codereview.context.domain.StaticAnalysisResult;
import co.fanki.codereview.provider.domain.ProviderGateway;
import co.fanki.codereview.provider.domain.ProviderInvocation;
import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.Finding;
import co.fanki.codereview.review.domain.ProducerOutcome;
import co.fanki.codereview.review.domain.ReviewCancelledException;
import co.fanki.codereview.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Base of the producers that ask a model, through the provider gateway, to
 * review a file.
 *
 * <p>Subclasses contribute the system prompt and the focus of the review.
 * The base builds the user prompt, calls the gateway, parses the
 * completion, optionally asks the model to double check its own findings
 * and drops findings under the confidence threshold.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class PromptedProducer implements Producer {

    private static final Logger LOG = LoggerFactory.getLogger(
            PromptedProducer.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String USER_PROMPT_TEMPLATE = """
            Review the following %s file for %s.

            File: %s
            ```%s
            %s
            ```
            %s
            Return ONLY a JSON object, first character { and last character }:
            {
              "reasoning": "short explanation of the overall assessment",
              "issues": [
                {
                  "severity": "critical|major|minor|info",
                  "category": "bug|security|performance|style|documentation|best_practice",
                  "line_start": 1,
                  "line_end": 1,
                  "title": "short title",
                  "description": "what is wrong",
                  "suggestion": "how to fix it",
                  "suggested_code": "replacement code or null",
                  "confidence": 0.0,
                  "cwe_id": "CWE id or null",
                  "impact": "impact or null"
                }
              ],
              "overall_quality_score": 0
            }
            """;

    private static final String REFLECTION_PROMPT_TEMPLATE = """
            You reviewed this code and reported the numbered issues below.
            Re-check each one against the code. Return ONLY JSON:
            {"false_positives": [indexes], "confidence_adjustments": {"index": 0.0}}

            Issues:
            %s
            Code:
            ```
            %s
            ```
            """;

    private final ProviderGateway gateway;

    private final FindingParser parser;

    private final double confidenceThreshold;

    private final boolean selfReflection;

    /**
     * Creates the producer.
     *
     * @param theGateway the provider gateway
     * @param theParser the completion parser
     * @param theConfidenceThreshold findings below it are dropped
     * @param isSelfReflection whether to ask the model to re-check findings
     */
    protected PromptedProducer(final ProviderGateway theGateway,
            final FindingParser theParser, final double theConfidenceThreshold,
            final boolean isSelfReflection) {
        this.gateway = Preconditions.requireNonNull(theGateway,
                "Provider gateway is required");
        this.parser = Preconditions.requireNonNull(theParser,
                "Finding parser is required");
        this.confidenceThreshold = Preconditions.requireUnitInterval(
                theConfidenceThreshold, "Confidence threshold must be in [0, 1]");
        this.selfReflection = isSelfReflection;
    }

    /**
     * Returns the reviewer persona given to the model.
     *
     * @return the system prompt
     */
    protected abstract String systemPrompt();

    /**
     * Returns what the review concentrates on, e.g. "security vulnerabilities".
     *
     * @return the focus
     */
    protected abstract String focus();

    @Override
    public ProducerOutcome produce(final CodeUnit unit,
            final ReviewContext context) {
        final long start = System.currentTimeMillis();
        LOG.info("Producer {} started on {}", name(), unit.path());
        try {
            final ProviderInvocation invocation = gateway.invoke(systemPrompt(),
                    userPrompt(unit, context), parser::isParsable);
            final FindingParser.Parsed parsed = parser.parse(name(),
                    invocation.content(), unit.path());

            double cost = invocation.cost();
            List<Finding> findings = parsed.findings();
            if (selfReflection && !findings.isEmpty()) {
                final Reflection reflection = reflect(unit, findings);
                findings = reflection.findings();
                cost += reflection.cost();
            }

            final List<Finding> confident = findings.stream()
                    .filter(f -> f.confidence() >= confidenceThreshold)
                    .toList();

            final long elapsed = System.currentTimeMillis() - start;
            LOG.info("Producer {} finished {}: {} findings, {}ms, ${}",
                    name(), unit.path(), confident.size(), elapsed, cost);
            return ProducerOutcome.succeeded(name(), confident,
                    parsed.reasoning(), parsed.qualityScore(), elapsed, cost);

        } catch (final RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ReviewCancelledException(unit.path());
            }
            LOG.warn("Producer {} failed on {}: {}", name(), unit.path(),
                    e.getMessage());
            return ProducerOutcome.failed(name(), e.getMessage(),
                    System.currentTimeMillis() - start);
        }
    }

    String userPrompt(final CodeUnit unit, final ReviewContext context) {
        return String.format(USER_PROMPT_TEMPLATE, unit.language(), focus(),
                unit.path(), unit.language(), unit.content(),
                contextSection(context));
    }

    private String contextSection(final ReviewContext context) {
        if (context == null) {
            return "";
        }
        final StringBuilder section = new StringBuilder();
        final StaticAnalysisResult analysis = context.staticAnalysis();
        if (analysis != null && analysis.succeeded()
                && !analysis.issues().isEmpty()) {
            section.append("\n<static_analysis>\n")
                    .append(analysis.tool()).append(" found ")
                    .append(analysis.issues().size()).append(" issues:\n");
            for (StaticAnalysisResult.StaticIssue issue : analysis.issues()) {
                section.append("- line ").append(issue.line()).append(" [")
                        .append(issue.rule()).append("] ")
                        .append(issue.message()).append('\n');
            }
            section.append("</static_analysis>\n");
        }
        if (!context.bestPractices().isEmpty()) {
            section.append("\n<best_practices>\n");
            for (KnowledgeSnippet snippet : context.bestPractices()) {
                section.append("- ").append(snippet.title()).append(": ")
                        .append(snippet.content()).append('\n');
            }
            section.append("</best_practices>\n");
        }
        return section.toString();
    }

    /**
     * Asks the model to re-check its findings. Any failure keeps the
     * findings unchanged.
     */
    private Reflection reflect(final CodeUnit unit, final List<Finding> findings) {
        final StringBuilder listed = new StringBuilder();
        for (int i = 0; i < findings.size(); i++) {
            final Finding finding = findings.get(i);
            listed.append('[').append(i).append("] line ")
                    .append(finding.lineStart()).append(": ")
                    .append(finding.title()).append('\n');
        }
        try {
            final ProviderInvocation invocation = gateway.invoke(
                    "You are a self-reflective code reviewer.",
                    String.format(REFLECTION_PROMPT_TEMPLATE, listed,
                            unit.content()),
                    parser::isParsable);
            final JsonNode root = MAPPER.readTree(
                    parser.extractJson(invocation.content()));

            final Set<Integer> falsePositives = new HashSet<>();
            final JsonNode rejected = root.path("false_positives");
            if (rejected.isArray()) {
                rejected.forEach(node -> falsePositives.add(node.asInt(-1)));
            }
            final JsonNode adjustments = root.path("confidence_adjustments");

            final List<Finding> kept = new ArrayList<>();
            for (int i = 0; i < findings.size(); i++) {
                if (falsePositives.contains(i)) {
                    continue;
                }
                Finding finding = findings.get(i);
                final JsonNode adjusted = adjustments.get(String.valueOf(i));
                if (adjusted != null && adjusted.isNumber()) {
                    final double confidence = Math.max(0.0,
                            Math.min(1.0, adjusted.asDouble()));
                    finding = finding.withMerge(confidence, finding.sources());
                }
                kept.add(finding);
            }
            LOG.debug("Producer {} self-reflection dropped {} findings on {}",
                    name(), findings.size() - kept.size(), unit.path());
            return new Reflection(kept, invocation.cost());

        } catch (final JsonProcessingException | RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ReviewCancelledException(unit.path());
            }
            LOG.warn("Producer {} self-reflection failed on {}: {}", name(),
                    unit.path(), e.getMessage());
            return new Reflection(findings, 0.0);
        }
    }

    private record Reflection(List<Finding> findings, double cost) {
    }

}
