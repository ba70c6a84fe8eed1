package com.williamcallahan.markdownpreview.domain.markdown;

/**
 * Per-document preview configuration.
 *
 * @param breaks render single line breaks as hard breaks
 * @param linkify turn bare URLs into links
 */
public record PreviewSettings(boolean breaks, boolean linkify) {

    public static final PreviewSettings DEFAULTS = new PreviewSettings(false, true);
}
