package co.fanki.codereview.context.domain;

import java.util.List;

/**
 * Source of contextual guidance handed to the producers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface KnowledgeStore {

    /**
     * Returns the snippets most relevant to the query.
     *
     * @param query the free text query
     * @param language the language of the file under review
     * @param topK the maximum number of snippets
     * @return the snippets, best first, possibly empty
     */
    List<KnowledgeSnippet> query(String query, String language, int topK);

}
