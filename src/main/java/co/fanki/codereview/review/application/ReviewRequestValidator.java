package co.fanki.codereview.review.application;

import co.fanki.codereview.review.domain.CodeUnit;
import co.fanki.codereview.review.domain.ReviewValidationException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a submitted batch and turns it into code units.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReviewRequestValidator {

    private final int maxFiles;
    private final int maxFileSize;

    /**
     * Creates a new ReviewRequestValidator.
     *
     * @param theMaxFiles the maximum files per batch
     * @param theMaxFileSize the maximum size of a file, in UTF-8 bytes
     */
    public ReviewRequestValidator(final int theMaxFiles,
            final int theMaxFileSize) {
        this.maxFiles = theMaxFiles;
        this.maxFileSize = theMaxFileSize;
    }

    /**
     * Validates the request.
     *
     * @param request the submitted batch
     * @return the code units, in submission order
     * @throws ReviewValidationException on the first violation
     */
    public List<CodeUnit> validate(final ReviewRequest request) {
        if (request == null || request.files() == null
                || request.files().isEmpty()) {
            throw new ReviewValidationException("At least one file is required");
        }
        if (request.files().size() > maxFiles) {
            throw new ReviewValidationException("Too many files: "
                    + request.files().size() + " (max " + maxFiles + ")");
        }

        final Set<String> paths = new HashSet<>();
        final List<CodeUnit> units = new ArrayList<>();
        for (ReviewRequest.FileInput file : request.files()) {
            if (file == null || file.path() == null || file.path().isBlank()) {
                throw new ReviewValidationException("File path is required");
            }
            if (file.content() == null || file.content().isBlank()) {
                throw new ReviewValidationException("File content is required: "
                        + file.path());
            }
            final int size = file.content().getBytes(StandardCharsets.UTF_8).length;
            if (size > maxFileSize) {
                throw new ReviewValidationException("File too large: "
                        + file.path() + " (" + size + " bytes, max "
                        + maxFileSize + ")");
            }
            if (!paths.add(file.path())) {
                throw new ReviewValidationException("Duplicate file path: "
                        + file.path());
            }
            units.add(CodeUnit.of(file.path(), file.content(), file.language()));
        }
        return units;
    }

    public int maxFiles() {
        return maxFiles;
    }

    public int maxFileSize() {
        return maxFileSize;
    }

}
