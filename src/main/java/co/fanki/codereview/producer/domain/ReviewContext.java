package co.fanki.codereview.producer.domain;

import co.fanki.codereview.context.domain.KnowledgeSnippet;
import co.fanki.codereview.context.domain.StaticAnalysisResult;

import java.util.List;

/**
 * What the earlier stages learned about a file, handed to each producer.
 *
 * @param staticAnalysis the static check result, may be null
 * @param bestPractices the knowledge snippets, possibly empty
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReviewContext(
        StaticAnalysisResult staticAnalysis,
        List<KnowledgeSnippet> bestPractices) {

    /** Compact constructor. */
    public ReviewContext {
        bestPractices = bestPractices == null ? List.of() : List.copyOf(bestPractices);
    }

    /**
     * Returns a context with nothing in it.
     *
     * @return the empty context
     */
    public static ReviewContext empty() {
        return new ReviewContext(null, List.of());
    }

}
