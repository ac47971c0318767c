package co.fanki.codereview.context.domain;

import co.fanki.codereview.review.domain.CodeUnit;

/**
 * Structural checks run over a file before any producer sees it.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface StaticAnalyzer {

    /**
     * Returns the tool name reported with each result.
     *
     * @return the name
     */
    String name();

    /**
     * Analyzes one file.
     *
     * @param unit the file
     * @return the result, never null
     */
    StaticAnalysisResult analyze(CodeUnit unit);

}
