package co.fanki.codereview.context.domain;

import co.fanki.codereview.shared.Preconditions;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Knowledge store over the {@code best_practices} table, ranked with
 * PostgreSQL full text search.
 *
 * <p>Practices tagged with the file's language or with {@code any} are
 * candidates; they are ordered by {@code ts_rank} against the query.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JdbiKnowledgeStore implements KnowledgeStore {

    /** Ranked lookup. Uses: idx_best_practices_search (GIN), idx_best_practices_language. */
    public static final String SEARCH = """
            SELECT title, content, language,
                   ts_rank(search_vector, plainto_tsquery('english', :query)) AS relevance
            FROM best_practices
            WHERE language IN (:language, 'any')
            ORDER BY relevance DESC, title
            LIMIT :topK
            """;

    private final Jdbi jdbi;

    /**
     * Creates the store.
     *
     * @param theJdbi the JDBI instance
     */
    public JdbiKnowledgeStore(final Jdbi theJdbi) {
        this.jdbi = Preconditions.requireNonNull(theJdbi, "Jdbi is required");
    }

    @Override
    public List<KnowledgeSnippet> query(final String query,
            final String language, final int topK) {
        Preconditions.requireNonBlank(query, "Query is required");
        Preconditions.requirePositive(topK, "topK must be positive");
        return jdbi.withHandle(handle -> handle.createQuery(SEARCH)
                .bind("query", query)
                .bind("language", language == null ? "any" : language)
                .bind("topK", topK)
                .map(new KnowledgeSnippetRowMapper())
                .list());
    }

    /**
     * Row mapper for knowledge snippets.
     */
    static class KnowledgeSnippetRowMapper implements RowMapper<KnowledgeSnippet> {

        @Override
        public KnowledgeSnippet map(final ResultSet rs,
                final StatementContext ctx) throws SQLException {
            return new KnowledgeSnippet(
                    rs.getString("title"),
                    rs.getString("content"),
                    rs.getString("language"),
                    rs.getDouble("relevance"));
        }
    }

}
