package co.fanki.codereview.review.domain;

import co.fanki.codereview.shared.Preconditions;
import co.fanki.codereview.shared.ValueObject;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * One source file submitted for review.
 *
 * <p>Created once per review request and never changed afterwards. The
 * identity of a unit is its path together with its content fingerprint;
 * two units with the same path but different content are different units
 * and never share cached results.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CodeUnit implements ValueObject {

    private static final long serialVersionUID = 1L;

    private static final Map<String, String> LANGUAGE_BY_EXTENSION = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("java", "java"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("cpp", "cpp"),
            Map.entry("cc", "cpp"),
            Map.entry("h", "cpp"),
            Map.entry("rb", "ruby"),
            Map.entry("kt", "kotlin"),
            Map.entry("cs", "csharp"),
            Map.entry("php", "php"));

    private final String path;
    private final String content;
    private final String language;
    private final ContentFingerprint fingerprint;

    private CodeUnit(final String thePath, final String theContent,
            final String theLanguage) {
        this.path = Preconditions.requireNonBlank(thePath,
                "File path is required");
        this.content = Preconditions.requireNonNull(theContent,
                "File content is required");
        this.language = theLanguage != null && !theLanguage.isBlank()
                ? theLanguage.trim().toLowerCase(Locale.ROOT)
                : detectLanguage(thePath);
        this.fingerprint = ContentFingerprint.of(theContent);
    }

    /**
     * Creates a code unit, computing its fingerprint.
     *
     * @param path the repository relative path
     * @param content the file content
     * @param language the language, or null to detect it from the extension
     * @return the new unit
     */
    public static CodeUnit of(final String path, final String content,
            final String language) {
        return new CodeUnit(path, content, language);
    }

    /**
     * Detects the language from the file extension.
     *
     * @param path the file path
     * @return the language name, or {@code "unknown"}
     */
    public static String detectLanguage(final String path) {
        if (path == null) {
            return "unknown";
        }
        final int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) {
            return "unknown";
        }
        final String extension = path.substring(dot + 1)
                .toLowerCase(Locale.ROOT);
        return LANGUAGE_BY_EXTENSION.getOrDefault(extension, "unknown");
    }

    public String path() {
        return path;
    }

    public String content() {
        return content;
    }

    public String language() {
        return language;
    }

    /**
     * Returns the content size in UTF-8 bytes.
     *
     * @return the size in bytes
     */
    public int size() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    public ContentFingerprint fingerprint() {
        return fingerprint;
    }

    /**
     * Returns the number of lines in the content.
     *
     * @return the line count, zero for empty content
     */
    public int lineCount() {
        return content.isEmpty() ? 0 : (int) content.lines().count();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final CodeUnit that = (CodeUnit) obj;
        return path.equals(that.path) && fingerprint.equals(that.fingerprint);
    }

    @Override
    public int hashCode() {
        return 31 * path.hashCode() + fingerprint.hashCode();
    }

    @Override
    public String toString() {
        return path + "@" + fingerprint.shortValue();
    }

}
