package com.williamcallahan.markdownpreview.domain.markdown;

import java.net.URI;

/**
 * A markdown document supplied by the editor or workspace.
 */
public interface MarkdownDocument {

    /**
     * Stable identity of the document.
     *
     * @return document URI
     */
    URI uri();

    /**
     * Per-document version counter. Must never decrease for the same URI.
     *
     * @return current version
     */
    int version();

    /**
     * Full document text, including any front matter.
     *
     * @return document text
     */
    String getText();
}
