package com.williamcallahan.markdownpreview.service.markdown;

/**
 * Pluggable syntax highlighter for fenced code blocks.
 */
public interface CodeHighlighter {

    /**
     * @param languageId highlighter language id, after alias resolution
     * @return true if {@link #highlight} can handle the language
     */
    boolean supportsLanguage(String languageId);

    /**
     * Produces annotated markup for a code block. May throw; callers degrade to plain code.
     *
     * @param languageId highlighter language id
     * @param code raw code
     * @param ignoreIllegals keep going on invalid syntax instead of failing
     * @return highlighted markup, already HTML-safe
     */
    String highlight(String languageId, String code, boolean ignoreIllegals);
}
