package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.Preconditions;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * One issue reported about a file.
 *
 * <p>Producers create findings from provider output. Nothing mutates a
 * finding afterwards: the consolidator derives a merged copy through
 * {@link #withMerge(double, Collection)} when several producers report the
 * same issue.</p>
 *
 * @param id the finding id
 * @param severity the severity
 * @param category the category
 * @param lineStart the first line, 0 when unknown
 * @param lineEnd the last line, may be null
 * @param title the short title
 * @param description the full description
 * @param suggestion how to fix, may be null
 * @param suggestedPatch replacement code, may be null
 * @param confidence the confidence in [0, 1]
 * @param sources the names of the producers that reported it
 * @param originMetadata extra producer data such as {@code cwe_id}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Finding(
        String id,
        Severity severity,
        IssueCategory category,
        int lineStart,
        Integer lineEnd,
        String title,
        String description,
        String suggestion,
        String suggestedPatch,
        double confidence,
        SortedSet<String> sources,
        Map<String, String> originMetadata) {

    /** Maximum title length kept by producers. */
    public static final int MAX_TITLE_LENGTH = 200;

    /** Compact constructor, validates and freezes collections. */
    public Finding {
        Preconditions.requireNonBlank(id, "Finding id is required");
        Preconditions.requireNonNull(severity, "Severity is required");
        Preconditions.requireNonNull(category, "Category is required");
        Preconditions.require(lineStart >= 0,
                "Line start cannot be negative: " + lineStart);
        Preconditions.require(lineEnd == null || lineEnd >= lineStart,
                "Line end cannot precede line start");
        Preconditions.requireNonBlank(title, "Finding title is required");
        Preconditions.requireUnitInterval(confidence,
                "Confidence must be within [0, 1]: " + confidence);
        description = description == null ? "" : description;
        sources = Collections.unmodifiableSortedSet(
                sources == null ? new TreeSet<>() : new TreeSet<>(sources));
        originMetadata = originMetadata == null
                ? Map.of()
                : Collections.unmodifiableMap(
                        new LinkedHashMap<>(originMetadata));
    }

    /**
     * Starts a builder for a finding reported by one producer.
     *
     * @param source the producer name
     * @return a new builder
     */
    public static Builder reportedBy(final String source) {
        return new Builder(source);
    }

    /**
     * Returns a copy carrying the merged confidence and sources.
     *
     * @param mergedConfidence the group confidence
     * @param mergedSources the union of the group's sources
     * @return a new finding, this one is unchanged
     */
    public Finding withMerge(final double mergedConfidence,
            final Collection<String> mergedSources) {
        return new Finding(id, severity, category, lineStart, lineEnd, title,
                description, suggestion, suggestedPatch, mergedConfidence,
                new TreeSet<>(mergedSources), originMetadata);
    }

    /** Builder used by the finding parser and by tests. */
    public static final class Builder {

        private final String source;
        private Severity severity = Severity.MINOR;
        private IssueCategory category = IssueCategory.STYLE;
        private int lineStart;
        private Integer lineEnd;
        private String title;
        private String description;
        private String suggestion;
        private String suggestedPatch;
        private double confidence = 0.8;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder(final String theSource) {
            this.source = Preconditions.requireNonBlank(theSource,
                    "Finding source is required");
        }

        public Builder severity(final Severity value) {
            this.severity = value;
            return this;
        }

        public Builder category(final IssueCategory value) {
            this.category = value;
            return this;
        }

        public Builder lines(final int start, final Integer end) {
            this.lineStart = start;
            this.lineEnd = end;
            return this;
        }

        public Builder title(final String value) {
            this.title = value;
            return this;
        }

        public Builder description(final String value) {
            this.description = value;
            return this;
        }

        public Builder suggestion(final String value) {
            this.suggestion = value;
            return this;
        }

        public Builder suggestedPatch(final String value) {
            this.suggestedPatch = value;
            return this;
        }

        public Builder confidence(final double value) {
            this.confidence = value;
            return this;
        }

        public Builder metadata(final String key, final String value) {
            if (value != null && !value.isBlank()) {
                metadata.put(key, value);
            }
            return this;
        }

        /**
         * Builds the finding with a fresh id.
         *
         * @return the finding
         * @throws IllegalArgumentException if a required field is invalid
         */
        public Finding build() {
            final String trimmedTitle = title != null
                    && title.length() > MAX_TITLE_LENGTH
                    ? title.substring(0, MAX_TITLE_LENGTH)
                    : title;
            return new Finding(UUID.randomUUID().toString(), severity,
                    category, lineStart, lineEnd, trimmedTitle, description,
                    suggestion, suggestedPatch, confidence,
                    new TreeSet<>(List.of(source)), metadata);
        }
    }

}
