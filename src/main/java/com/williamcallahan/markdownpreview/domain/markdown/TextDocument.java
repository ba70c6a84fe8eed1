package com.williamcallahan.markdownpreview.domain.markdown;

import java.net.URI;
import java.util.Objects;

/**
 * Immutable in-memory markdown document.
 *
 * @param uri document identity
 * @param version document version
 * @param text document text
 */
public record TextDocument(URI uri, int version, String text) implements MarkdownDocument {

    public TextDocument {
        Objects.requireNonNull(uri, "Document URI cannot be null");
        Objects.requireNonNull(text, "Document text cannot be null");
    }

    @Override
    public String getText() {
        return text;
    }

    /**
     * Returns the next version of this document with new text.
     *
     * @param newText updated text
     * @return document with the version incremented
     */
    public TextDocument withText(String newText) {
        return new TextDocument(uri, version + 1, newText);
    }
}
