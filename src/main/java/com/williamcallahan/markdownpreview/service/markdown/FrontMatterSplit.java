package com.williamcallahan.markdownpreview.service.markdown;

import java.util.Objects;
import java.util.Optional;

/**
 * A document split into its leading metadata block and markdown body.
 *
 * @param frontMatter raw metadata block including its fences, empty when the document has none
 * @param body markdown text following the block
 * @param lineOffset number of lines the block occupied
 */
public record FrontMatterSplit(Optional<String> frontMatter, String body, int lineOffset) {

    public FrontMatterSplit {
        Objects.requireNonNull(frontMatter, "Front matter cannot be null");
        Objects.requireNonNull(body, "Body cannot be null");
        if (lineOffset < 0) {
            throw new IllegalArgumentException("Line offset cannot be negative: " + lineOffset);
        }
    }

    static FrontMatterSplit none(String text) {
        return new FrontMatterSplit(Optional.empty(), text, 0);
    }
}
