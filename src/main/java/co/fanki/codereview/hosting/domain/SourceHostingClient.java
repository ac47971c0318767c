package co.fanki.codereview.hosting.domain;

import java.util.List;

/**
 * Access to pull requests on a source hosting service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface SourceHostingClient {

    /**
     * Fetches the reviewable files of a pull request.
     *
     * <p>Removed files, binaries, unsupported languages and files with very
     * large diffs are skipped.</p>
     *
     * @param repository the repository, {@code owner/name}
     * @param number the pull request number
     * @return the files at the head commit
     * @throws HostingException if the service cannot be reached or refuses
     */
    List<PullRequestFile> fetchPullRequestFiles(String repository, int number);

    /**
     * Posts a comment on the pull request conversation.
     *
     * @param repository the repository, {@code owner/name}
     * @param number the pull request number
     * @param body the markdown body
     * @throws HostingException if the comment cannot be posted
     */
    void postComment(String repository, int number, String body);

}
