package com.exprformat.core.format;

import java.util.Objects;

/**
 * Represents the output of a formatter.
 *
 * @param formatterId id of the formatter that produced this output
 * @param content formatted content
 * @param contentType media type of the content
 * @param fileExtension file extension for this content
 */
public record FormattedOutput(
    String formatterId,
    String content,
    String contentType,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public FormattedOutput {
        Objects.requireNonNull(formatterId, "formatterId must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(contentType, "contentType must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }
}
