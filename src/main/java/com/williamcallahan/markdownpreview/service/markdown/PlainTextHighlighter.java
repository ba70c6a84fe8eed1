package com.williamcallahan.markdownpreview.service.markdown;

import com.williamcallahan.markdownpreview.support.HtmlEscaping;

/**
 * Highlighter that knows no languages. Every fence renders through the plain-code fallback.
 */
public class PlainTextHighlighter implements CodeHighlighter {

    @Override
    public boolean supportsLanguage(String languageId) {
        return false;
    }

    @Override
    public String highlight(String languageId, String code, boolean ignoreIllegals) {
        return HtmlEscaping.escapeHtml(code);
    }
}
