package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.support.HtmlEscaping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Bridges fenced code blocks to the {@link CodeHighlighter}.
 *
 * <p>Language hints are first mapped through an alias table for names the highlighter
 * spells differently. Unknown languages and highlighter failures fall back to escaped,
 * unhighlighted code so a broken block never breaks the render.</p>
 */
public class FenceHighlighting {

    private static final Logger logger = LoggerFactory.getLogger(FenceHighlighting.class);

    private static final Map<String, String> LANGUAGE_ALIASES = Map.of(
        "tsx", "jsx",
        "typescriptreact", "jsx",
        "json5", "json",
        "c#", "cs"
    );

    private final CodeHighlighter highlighter;

    public FenceHighlighting(CodeHighlighter highlighter) {
        this.highlighter = Objects.requireNonNull(highlighter, "Highlighter cannot be null");
    }

    /**
     * Maps a fence language hint to the highlighter's id for it.
     *
     * @param languageHint hint from the fence info string, may be null
     * @return aliased id, or the hint unchanged when no alias applies
     */
    public static String resolveLanguage(String languageHint) {
        if (languageHint == null || languageHint.isEmpty()) {
            return languageHint;
        }
        return LANGUAGE_ALIASES.getOrDefault(languageHint.toLowerCase(Locale.ROOT), languageHint);
    }

    /**
     * Highlights a code block.
     *
     * @param code raw code
     * @param languageHint language hint, may be null or empty
     * @return highlighted markup wrapped in a {@code div}, or escaped code in the fallback wrapper
     */
    public String highlight(String code, String languageHint) {
        String language = resolveLanguage(languageHint);
        if (language != null && !language.isEmpty()) {
            try {
                if (highlighter.supportsLanguage(language)) {
                    String highlighted = highlighter.highlight(language, code, true);
                    if (highlighted != null) {
                        return "<div>" + highlighted + "</div>";
                    }
                    logger.debug("Highlighter returned nothing for language '{}', rendering plain code", language);
                }
            } catch (RuntimeException e) {
                logger.debug("Highlighting failed for language '{}', rendering plain code: {}", language, e.getMessage());
            }
        }
        return "<code><div>" + HtmlEscaping.escapeHtml(code) + "</div></code>";
    }
}
