package co.fanki.codereview.hosting.domain;

import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * GitHub REST client for pull request reviews.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GitHubClient implements SourceHostingClient {

    private static final Logger LOG = LoggerFactory.getLogger(GitHubClient.class);

    private static final int PAGE_SIZE = 100;

    private static final int MAX_CHANGES = 1000;

    private static final String API_VERSION = "2022-11-28";

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(
            "python", "javascript", "typescript", "go", "java", "rust", "cpp");

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".gif", ".pdf", ".zip", ".jar");

    private final RestTemplate restTemplate;

    private final ObjectMapper objectMapper;

    private final String baseUrl;

    private final String token;

    /**
     * Creates the client.
     *
     * @param theRestTemplate the HTTP client
     * @param theObjectMapper the JSON mapper
     * @param theBaseUrl the API root, e.g. {@code https://api.github.com}
     * @param theToken the access token
     */
    public GitHubClient(final RestTemplate theRestTemplate,
            final ObjectMapper theObjectMapper, final String theBaseUrl,
            final String theToken) {
        this.restTemplate = Preconditions.requireNonNull(theRestTemplate,
                "RestTemplate is required");
        this.objectMapper = Preconditions.requireNonNull(theObjectMapper,
                "ObjectMapper is required");
        this.baseUrl = Preconditions.requireNonBlank(theBaseUrl,
                "Base URL is required");
        this.token = Preconditions.requireNonBlank(theToken,
                "GitHub token is required");
    }

    @Override
    public List<PullRequestFile> fetchPullRequestFiles(final String repository,
            final int number) {
        requireRepository(repository);
        final JsonNode pull = getJson(baseUrl + "/repos/" + repository
                + "/pulls/" + number);
        final String headSha = pull.path("head").path("sha").asText(null);

        final List<PullRequestFile> files = new ArrayList<>();
        int page = 1;
        while (true) {
            final JsonNode items = getJson(baseUrl + "/repos/" + repository
                    + "/pulls/" + number + "/files?per_page=" + PAGE_SIZE
                    + "&page=" + page);
            if (!items.isArray()) {
                break;
            }
            for (final JsonNode item : items) {
                final PullRequestFile file = toFile(repository, headSha, item);
                if (file != null) {
                    files.add(file);
                }
            }
            if (items.size() < PAGE_SIZE) {
                break;
            }
            page++;
        }
        LOG.info("Fetched {} reviewable files from {}#{}", files.size(),
                repository, number);
        return files;
    }

    @Override
    public void postComment(final String repository, final int number,
            final String body) {
        requireRepository(repository);
        final HttpHeaders headers = headers();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(baseUrl + "/repos/" + repository
                    + "/issues/" + number + "/comments",
                    new HttpEntity<>(Map.of("body", body), headers),
                    String.class);
            LOG.info("Posted review summary on {}#{}", repository, number);
        } catch (final RestClientException e) {
            throw new HostingException("Cannot comment on " + repository + "#"
                    + number + ": " + e.getMessage(), e);
        }
    }

    private PullRequestFile toFile(final String repository,
            final String headSha, final JsonNode item) {
        final String path = item.path("filename").asText("");
        if (path.isEmpty() || "removed".equals(item.path("status").asText())) {
            return null;
        }
        final String lower = path.toLowerCase(Locale.ROOT);
        if (BINARY_EXTENSIONS.stream().anyMatch(lower::endsWith)) {
            return null;
        }
        final int changes = item.path("changes").asInt(0);
        if (changes > MAX_CHANGES) {
            LOG.warn("Skipping {}: {} changed lines", path, changes);
            return null;
        }
        final String language = CodeUnit.detectLanguage(path);
        if (!SUPPORTED_LANGUAGES.contains(language)) {
            return null;
        }
        return new PullRequestFile(path,
                content(repository, headSha, path, item), language);
    }

    private String content(final String repository, final String headSha,
            final String path, final JsonNode item) {
        if (headSha != null) {
            final HttpHeaders headers = headers();
            headers.set(HttpHeaders.ACCEPT, "application/vnd.github.raw");
            try {
                final ResponseEntity<String> response = restTemplate.exchange(
                        baseUrl + "/repos/" + repository + "/contents/" + path
                                + "?ref=" + headSha,
                        HttpMethod.GET, new HttpEntity<>(headers), String.class);
                if (response.getBody() != null) {
                    return response.getBody();
                }
            } catch (final RestClientException e) {
                LOG.warn("Cannot fetch {} at {}, using the patch: {}", path,
                        headSha, e.getMessage());
            }
        }
        return item.path("patch").asText("");
    }

    private JsonNode getJson(final String url) {
        try {
            final ResponseEntity<String> response = restTemplate.exchange(url,
                    HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            return objectMapper.readTree(response.getBody() == null
                    ? "null" : response.getBody());
        } catch (final RestClientException e) {
            throw new HostingException("GitHub call failed: " + url + ": "
                    + e.getMessage(), e);
        } catch (final JsonProcessingException e) {
            throw new HostingException("Unreadable GitHub response: " + url, e);
        }
    }

    private HttpHeaders headers() {
        final HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.set(HttpHeaders.ACCEPT, "application/vnd.github+json");
        headers.set("X-GitHub-Api-Version", API_VERSION);
        return headers;
    }

    private static void requireRepository(final String repository) {
        Preconditions.requireNonBlank(repository, "Repository is required");
        Preconditions.require(repository.split("/").length == 2,
                "Repository must be owner/name: " + repository);
    }

}
