package co.fanki.codereview.hosting.domain;

/**
 * A file changed by a pull request, at the pull request's head.
 *
 * @param path the repository relative path
 * @param content the file content
 * @param language the language detected from the extension
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PullRequestFile(String path, String content, String language) {
}
