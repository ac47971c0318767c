package co.fanki.codereview.review.application;

import java.util.List;
import java.util.Map;

/**
 * A batch of files submitted for review.
 *
 * @param files the files
 * @param options the free-form review toggles, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReviewRequest(List<FileInput> files, Map<String, Object> options) {

    /**
     * One submitted file.
     *
     * @param path the repository relative path
     * @param content the file content
     * @param language the language, detected from the extension when null
     */
    public record FileInput(String path, String content, String language) {}

}
