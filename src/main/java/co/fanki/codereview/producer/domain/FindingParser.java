package co.fanki.codereview.producer.domain;

import co.fanki.codereview.review.domain.Finding;
import co.fanki.codereview.review.domain.IssueCategory;
import co.fanki.codereview.review.domain.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a producer's raw completion into findings.
 *
 * <p>The expected completion is a JSON object, optionally wrapped in a
 * markdown code fence:</p>
 * <pre>
 * {
 *   "reasoning": "...",
 *   "issues": [{"severity": "major", "category": "bug", "line_start": 10,
 *               "title": "...", "confidence": 0.9, ...}],
 *   "overall_quality_score": 85
 * }
 * </pre>
 *
 * <p>Missing fields take defaults; out of range values are clamped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FindingParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            FindingParser.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final double DEFAULT_CONFIDENCE = 0.8;

    private static final String DEFAULT_TITLE = "Issue found";

    /**
     * Checks whether a completion holds a JSON object.
     *
     * @param content the raw completion
     * @return true when it can be parsed
     */
    public boolean isParsable(final String content) {
        try {
            return MAPPER.readTree(extractJson(content)).isObject();
        } catch (final JsonProcessingException e) {
            return false;
        }
    }

    /**
     * Parses a completion.
     *
     * @param producer the producer name, recorded as the findings' source
     * @param content the raw completion
     * @param path the reviewed file, recorded in each finding's metadata
     * @return the parsed output
     * @throws IllegalArgumentException when the content is not JSON
     */
    public Parsed parse(final String producer, final String content,
            final String path) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(extractJson(content));
        } catch (final JsonProcessingException e) {
            LOG.warn("Unparsable {} output: {}", producer, e.getOriginalMessage());
            throw new IllegalArgumentException("Producer output is not JSON", e);
        }

        final List<Finding> findings = new ArrayList<>();
        final JsonNode issues = root.get("issues");
        if (issues != null && issues.isArray()) {
            for (final JsonNode issue : issues) {
                if (issue.isObject()) {
                    findings.add(parseIssue(producer, issue, path));
                }
            }
        }

        final String reasoning = getTextOrDefault(root, "reasoning", "");
        Double score = getDoubleOrNull(root, "overall_quality_score");
        if (score == null) {
            score = getDoubleOrNull(root, "score");
        }
        return new Parsed(findings, reasoning, score);
    }

    private Finding parseIssue(final String producer, final JsonNode node,
            final String path) {
        final int lineStart = Math.max(0, getIntOrDefault(node, "line_start", 0));
        Integer lineEnd = getIntOrNull(node, "line_end");
        if (lineEnd != null && lineEnd < lineStart) {
            lineEnd = null;
        }
        String title = getTextOrDefault(node, "title", DEFAULT_TITLE).strip();
        if (title.isEmpty()) {
            title = DEFAULT_TITLE;
        }
        final Double rawConfidence = getDoubleOrNull(node, "confidence");
        final double confidence = rawConfidence == null || rawConfidence.isNaN()
                ? DEFAULT_CONFIDENCE
                : Math.max(0.0, Math.min(1.0, rawConfidence));

        return Finding.reportedBy(producer)
                .severity(Severity.fromString(getTextOrNull(node, "severity")))
                .category(IssueCategory.fromString(
                        getTextOrNull(node, "category")))
                .lines(lineStart, lineEnd)
                .title(title)
                .description(getTextOrDefault(node, "description", ""))
                .suggestion(getTextOrNull(node, "suggestion"))
                .suggestedPatch(getTextOrNull(node, "suggested_code"))
                .confidence(confidence)
                .metadata("file", path)
                .metadata("cwe_id", getTextOrNull(node, "cwe_id"))
                .metadata("impact", getTextOrNull(node, "impact"))
                .build();
    }

    String extractJson(final String output) {
        if (output == null || output.isBlank()) {
            return "{}";
        }

        String cleaned = output.strip();

        // Strip markdown code fences if present
        if (cleaned.startsWith("```")) {
            final int firstNewline = cleaned.indexOf('\n');
            if (firstNewline > 0) {
                cleaned = cleaned.substring(firstNewline + 1);
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.lastIndexOf("```"));
            }
            cleaned = cleaned.strip();
        }

        final int start = cleaned.indexOf('{');
        final int end = cleaned.lastIndexOf('}');

        if (start >= 0 && end > start) {
            return cleaned.substring(start, end + 1);
        }

        return cleaned;
    }

    private String getTextOrDefault(final JsonNode node, final String field,
            final String defaultValue) {
        final JsonNode fieldNode = node.get(field);
        return fieldNode != null && !fieldNode.isNull()
                ? fieldNode.asText() : defaultValue;
    }

    private String getTextOrNull(final JsonNode node, final String field) {
        final JsonNode fieldNode = node.get(field);
        return fieldNode != null && !fieldNode.isNull()
                ? fieldNode.asText() : null;
    }

    private Integer getIntOrNull(final JsonNode node, final String field) {
        final JsonNode fieldNode = node.get(field);
        return fieldNode != null && !fieldNode.isNull() && fieldNode.isNumber()
                ? fieldNode.asInt() : null;
    }

    private int getIntOrDefault(final JsonNode node, final String field,
            final int defaultValue) {
        final Integer value = getIntOrNull(node, field);
        return value != null ? value : defaultValue;
    }

    private Double getDoubleOrNull(final JsonNode node, final String field) {
        final JsonNode fieldNode = node.get(field);
        return fieldNode != null && !fieldNode.isNull() && fieldNode.isNumber()
                ? fieldNode.asDouble() : null;
    }

    /**
     * Parsed producer output.
     *
     * @param findings the findings, unfiltered
     * @param reasoning the producer's reasoning text
     * @param qualityScore the producer's quality score, may be null
     */
    public record Parsed(List<Finding> findings, String reasoning,
            Double qualityScore) {
    }

}
