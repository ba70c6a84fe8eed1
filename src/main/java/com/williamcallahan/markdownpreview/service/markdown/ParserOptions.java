package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.domain.markdown.PreviewSettings;

/**
 * Global parser adapter flags.
 *
 * @param breaks render soft line breaks as {@code <br>}
 * @param linkify detect bare URLs and e-mail addresses as links
 * @param html pass raw HTML through instead of escaping it
 */
public record ParserOptions(boolean breaks, boolean linkify, boolean html) {

    public static final ParserOptions DEFAULTS = new ParserOptions(false, true, true);

    /**
     * Derives options from per-document settings.
     *
     * @param settings document settings
     * @param html whether raw HTML is allowed
     * @return adapter options
     */
    public static ParserOptions from(PreviewSettings settings, boolean html) {
        return new ParserOptions(settings.breaks(), settings.linkify(), html);
    }
}
