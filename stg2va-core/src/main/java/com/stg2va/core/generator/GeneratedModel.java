package com.stg2va.core.generator;

import java.util.Objects;

/**
 * Text produced by a {@link ModelGenerator}.
 *
 * @param name module or report name
 * @param content generated text
 * @param fileExtension file extension for this content, without leading dot
 */
public record GeneratedModel(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedModel {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the default file name, {@code name.extension}.
     *
     * @return file name
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
