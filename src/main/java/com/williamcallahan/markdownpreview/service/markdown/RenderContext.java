package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.PreviewSettings;

import java.net.URI;
import java.util.Objects;

/**
 * Per-call state of one render or parse.
 *
 * <p>Created fresh for every call and passed down through tokenization and rendering,
 * so nothing about the current document lives on the engine itself.</p>
 */
public final class RenderContext {

    private final URI documentUri;
    private final int lineOffset;
    private final PreviewSettings settings;
    private final SlugAllocator slugs;

    public RenderContext(URI documentUri, int lineOffset, PreviewSettings settings, SlugAllocator slugs) {
        this.documentUri = Objects.requireNonNull(documentUri, "Document URI cannot be null");
        if (lineOffset < 0) {
            throw new IllegalArgumentException("Line offset cannot be negative: " + lineOffset);
        }
        this.lineOffset = lineOffset;
        this.settings = Objects.requireNonNull(settings, "Preview settings cannot be null");
        this.slugs = Objects.requireNonNull(slugs, "Slug allocator cannot be null");
    }

    public URI documentUri() {
        return documentUri;
    }

    /**
     * Lines of front matter stripped before tokenizing. Already applied to token source maps.
     *
     * @return number of stripped lines
     */
    public int lineOffset() {
        return lineOffset;
    }

    public PreviewSettings settings() {
        return settings;
    }

    /**
     * Heading slug table for this call.
     *
     * @return allocator shared by every heading rendered in this call
     */
    public SlugAllocator slugs() {
        return slugs;
    }
}
