package co.fanki.codereview.context.domain;

/**
 * A piece of guidance returned by the knowledge store.
 *
 * @param title the practice title
 * @param content the guidance text
 * @param language the language it applies to, or {@code "any"}
 * @param relevance the store's ranking score
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record KnowledgeSnippet(
        String title,
        String content,
        String language,
        double relevance) {
}
